package com.perfsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identifies one performance series: a single test at a single thread level
 * of a task, on a build variant, in a project.
 *
 * @since 1.0.0
 */
public final class SeriesIdentifier implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String project;
    private final String variant;
    private final String task;
    private final String test;
    private final String threadLevel;

    /**
     * @throws IllegalArgumentException if any component is {@code null} or
     *                                  blank
     */
    @JsonCreator
    public SeriesIdentifier(@JsonProperty("project") String project,
            @JsonProperty("variant") String variant,
            @JsonProperty("task") String task,
            @JsonProperty("test") String test,
            @JsonProperty("threadLevel") String threadLevel) {
        this.project = requireNonBlank(project, "project");
        this.variant = requireNonBlank(variant, "variant");
        this.task = requireNonBlank(task, "task");
        this.test = requireNonBlank(test, "test");
        this.threadLevel = requireNonBlank(threadLevel, "threadLevel");
    }

    /**
     * Stable single-string key, used to partition points by series.
     *
     * <p>
     * Backslashes and slashes inside a component are escaped with a
     * backslash, so two identifiers share a key only when they are equal.
     * </p>
     *
     * @return the five escaped components joined with {@code '/'}
     */
    @JsonIgnore
    public String key() {
        return String.join("/", escape(project), escape(variant), escape(task), escape(test),
                escape(threadLevel));
    }

    public String getProject() {
        return project;
    }

    public String getVariant() {
        return variant;
    }

    public String getTask() {
        return task;
    }

    public String getTest() {
        return test;
    }

    public String getThreadLevel() {
        return threadLevel;
    }

    private static String escape(String component) {
        return component.replace("\\", "\\\\").replace("/", "\\/");
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesIdentifier that))
            return false;
        return project.equals(that.project)
                && variant.equals(that.variant)
                && task.equals(that.task)
                && test.equals(that.test)
                && threadLevel.equals(that.threadLevel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(project, variant, task, test, threadLevel);
    }

    @Override
    public String toString() {
        return project + " " + variant + " " + task + " " + test + " " + threadLevel;
    }
}
