package com.perfsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One measured result: the throughput of a test at a thread level for a
 * single revision.
 *
 * <p>
 * Points arrive as JSON. {@code order} is the chronological commit position
 * assigned by the CI system and is what series assembly sorts by.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is a mutable bean and is <strong>not</strong> thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PerformancePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private String project;
    private String variant;
    private String task;
    private String test;
    private String threadLevel;

    /** Commit hash the result was measured on. */
    private String revision;

    /** Chronological position of the revision. */
    private long order;

    /** Operations per second. */
    private double value;

    private Instant createTime;

    /** No-arg constructor required by Jackson. */
    public PerformancePoint() {
    }

    public PerformancePoint(SeriesIdentifier identifier, String revision, long order, double value) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        this.project = identifier.getProject();
        this.variant = identifier.getVariant();
        this.task = identifier.getTask();
        this.test = identifier.getTest();
        this.threadLevel = identifier.getThreadLevel();
        this.revision = revision;
        this.order = order;
        this.value = value;
    }

    /**
     * Build the identifier of the series this point belongs to.
     *
     * @return series identifier
     * @throws IllegalArgumentException if an identifying field is missing
     */
    @JsonIgnore
    public SeriesIdentifier getIdentifier() {
        return new SeriesIdentifier(project, variant, task, test, threadLevel);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getProject() {
        return project;
    }

    public void setProject(String project) {
        this.project = project;
    }

    public String getVariant() {
        return variant;
    }

    public void setVariant(String variant) {
        this.variant = variant;
    }

    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }

    public String getTest() {
        return test;
    }

    public void setTest(String test) {
        this.test = test;
    }

    public String getThreadLevel() {
        return threadLevel;
    }

    public void setThreadLevel(String threadLevel) {
        this.threadLevel = threadLevel;
    }

    public String getRevision() {
        return revision;
    }

    public void setRevision(String revision) {
        this.revision = revision;
    }

    public long getOrder() {
        return order;
    }

    public void setOrder(long order) {
        this.order = order;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public Instant getCreateTime() {
        return createTime;
    }

    public void setCreateTime(Instant createTime) {
        this.createTime = createTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PerformancePoint that))
            return false;
        return order == that.order
                && Double.compare(value, that.value) == 0
                && Objects.equals(project, that.project)
                && Objects.equals(variant, that.variant)
                && Objects.equals(task, that.task)
                && Objects.equals(test, that.test)
                && Objects.equals(threadLevel, that.threadLevel)
                && Objects.equals(revision, that.revision);
    }

    @Override
    public int hashCode() {
        return Objects.hash(project, variant, task, test, threadLevel, revision, order, value);
    }

    @Override
    public String toString() {
        return "PerformancePoint{" +
                "project='" + project + '\'' +
                ", variant='" + variant + '\'' +
                ", task='" + task + '\'' +
                ", test='" + test + '\'' +
                ", threadLevel='" + threadLevel + '\'' +
                ", revision='" + revision + '\'' +
                ", order=" + order +
                ", value=" + value +
                '}';
    }
}
