package com.opsdesk.runner.query.fixture;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/** Queryable entity used by the query tests. */
@Entity
@Table(name = "test_members")
public class Member {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private Integer age;

    @Column(length = 20)
    private String status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected Member() {}

    public Member(String name, Integer age, String status, Instant createdAt) {
        this.name = name;
        this.age = age;
        this.status = status;
        this.createdAt = createdAt;
    }

    public Long getId()           { return id; }
    public String getName()       { return name; }
    public Integer getAge()       { return age; }
    public String getStatus()     { return status; }
    public Instant getCreatedAt() { return createdAt; }
}
