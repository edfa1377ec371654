package com.opsdesk.runner.audit;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One audited command run.
 *
 * DB table: command_executions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "command_executions")
public class CommandExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String command;

    // Submitted options serialized as a JSON object.
    @Column(columnDefinition = "TEXT")
    private String options;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "user_name")
    private String userName;

    @Column(name = "user_email")
    private String userEmail;

    @Column(name = "exit_code")
    private Integer exitCode;

    @Column(columnDefinition = "TEXT")
    private String output;

    // Seconds, millisecond precision.
    @Column(name = "execution_time")
    private Double executionTime;

    @Column(nullable = false, length = 20)
    private String environment;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent")
    private String userAgent;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected CommandExecution() {}  // required by JPA

    public CommandExecution(String command, String environment, Instant startedAt) {
        this.command = command;
        this.environment = environment;
        this.startedAt = startedAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long getId()                        { return id; }
    public String getCommand()                 { return command; }
    public String getOptions()                 { return options; }
    public void setOptions(String o)           { this.options = o; }
    public String getUserId()                  { return userId; }
    public void setUserId(String id)           { this.userId = id; }
    public String getUserName()                { return userName; }
    public void setUserName(String name)       { this.userName = name; }
    public String getUserEmail()               { return userEmail; }
    public void setUserEmail(String email)     { this.userEmail = email; }
    public Integer getExitCode()               { return exitCode; }
    public void setExitCode(Integer code)      { this.exitCode = code; }
    public String getOutput()                  { return output; }
    public void setOutput(String output)       { this.output = output; }
    public Double getExecutionTime()           { return executionTime; }
    public void setExecutionTime(Double t)     { this.executionTime = t; }
    public String getEnvironment()             { return environment; }
    public String getIpAddress()               { return ipAddress; }
    public void setIpAddress(String ip)        { this.ipAddress = ip; }
    public String getUserAgent()               { return userAgent; }
    public void setUserAgent(String ua)        { this.userAgent = ua; }
    public Instant getStartedAt()              { return startedAt; }
    public Instant getCompletedAt()            { return completedAt; }
    public void setCompletedAt(Instant t)      { this.completedAt = t; }
    public Instant getCreatedAt()              { return createdAt; }
    public Instant getUpdatedAt()              { return updatedAt; }
}
