package com.opsdesk.runner.config;

import com.opsdesk.runner.command.RiskLevel;
import com.opsdesk.runner.policy.EnvironmentRestriction;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings under {@code opsdesk.runner.*} in application.yml.
 */
@ConfigurationProperties(prefix = "opsdesk.runner")
public class RunnerProperties {

    /** Master switch. When off the API refuses every request. */
    private boolean enabled = true;

    private String environment = "local";

    private Duration maxExecutionTime = Duration.ofSeconds(300);

    /** Write every execution to the audit table. */
    private boolean logExecutions = true;

    private boolean requireConfirmationForProduction = true;

    /** Command class name to enabled flag. */
    private Map<String, Boolean> commands = new LinkedHashMap<>();

    private AutoDiscovery autoDiscovery = new AutoDiscovery();

    private Map<String, Restriction> environmentRestrictions = defaultRestrictions();

    private Audit audit = new Audit();

    public Map<String, EnvironmentRestriction> toRestrictions() {
        Map<String, EnvironmentRestriction> out = new LinkedHashMap<>();
        environmentRestrictions.forEach((env, r) ->
                out.put(env, new EnvironmentRestriction(r.getAllowedRiskLevels(), r.isDisableUnlessConfirmed())));
        return out;
    }

    private static Map<String, Restriction> defaultRestrictions() {
        Map<String, Restriction> defaults = new LinkedHashMap<>();
        defaults.put("production", new Restriction(EnumSet.of(RiskLevel.LOW), true));
        defaults.put("staging", new Restriction(EnumSet.of(RiskLevel.LOW, RiskLevel.MEDIUM), false));
        return defaults;
    }

    // ------------------------------------------------------------------

    public static class AutoDiscovery {
        private boolean enabled = false;
        private List<String> basePackages = new ArrayList<>();
        /** Register discovered commands; otherwise they are only reported. */
        private boolean defaultEnabled = false;

        public boolean isEnabled()                       { return enabled; }
        public void setEnabled(boolean enabled)          { this.enabled = enabled; }
        public List<String> getBasePackages()            { return basePackages; }
        public void setBasePackages(List<String> p)      { this.basePackages = p; }
        public boolean isDefaultEnabled()                { return defaultEnabled; }
        public void setDefaultEnabled(boolean b)         { this.defaultEnabled = b; }
    }

    public static class Restriction {
        private Set<RiskLevel> allowedRiskLevels = EnumSet.noneOf(RiskLevel.class);
        private boolean disableUnlessConfirmed = false;

        public Restriction() {}

        Restriction(Set<RiskLevel> allowedRiskLevels, boolean disableUnlessConfirmed) {
            this.allowedRiskLevels = allowedRiskLevels;
            this.disableUnlessConfirmed = disableUnlessConfirmed;
        }

        public Set<RiskLevel> getAllowedRiskLevels()          { return allowedRiskLevels; }
        public void setAllowedRiskLevels(Set<RiskLevel> s)    { this.allowedRiskLevels = s; }
        public boolean isDisableUnlessConfirmed()             { return disableUnlessConfirmed; }
        public void setDisableUnlessConfirmed(boolean b)      { this.disableUnlessConfirmed = b; }
    }

    public static class Audit {
        private int keepLogsForDays = 90;

        public int getKeepLogsForDays()              { return keepLogsForDays; }
        public void setKeepLogsForDays(int days)     { this.keepLogsForDays = days; }
    }

    // ------------------------------------------------------------------

    public boolean isEnabled()                                   { return enabled; }
    public void setEnabled(boolean enabled)                      { this.enabled = enabled; }
    public String getEnvironment()                               { return environment; }
    public void setEnvironment(String environment)               { this.environment = environment; }
    public Duration getMaxExecutionTime()                        { return maxExecutionTime; }
    public void setMaxExecutionTime(Duration d)                  { this.maxExecutionTime = d; }
    public boolean isLogExecutions()                             { return logExecutions; }
    public void setLogExecutions(boolean logExecutions)          { this.logExecutions = logExecutions; }
    public boolean isRequireConfirmationForProduction()          { return requireConfirmationForProduction; }
    public void setRequireConfirmationForProduction(boolean b)   { this.requireConfirmationForProduction = b; }
    public Map<String, Boolean> getCommands()                    { return commands; }
    public void setCommands(Map<String, Boolean> commands)       { this.commands = commands; }
    public AutoDiscovery getAutoDiscovery()                      { return autoDiscovery; }
    public void setAutoDiscovery(AutoDiscovery autoDiscovery)    { this.autoDiscovery = autoDiscovery; }
    public Map<String, Restriction> getEnvironmentRestrictions() { return environmentRestrictions; }
    public void setEnvironmentRestrictions(Map<String, Restriction> r) { this.environmentRestrictions = r; }
    public Audit getAudit()                                      { return audit; }
    public void setAudit(Audit audit)                            { this.audit = audit; }
}
