package com.example.aijobscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A named, cron-scheduled AI prompt.
 * <p>
 * The slug is derived from the name and used to locate result artifacts on disk,
 * so it is regenerated whenever the name changes.
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_job_enabled", columnList = "enabled")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_job_name", columnNames = "name"),
        @UniqueConstraint(name = "uk_job_slug", columnNames = "slug")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job {

    private static final Pattern NON_SLUG_CHARS = Pattern.compile("[^\\w\\s-]");
    private static final Pattern SEPARATOR_RUNS = Pattern.compile("[-\\s]+");

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "slug", nullable = false, length = 120)
    private String slug;

    /**
     * Prompt sent to the generation worker
     */
    @Column(name = "prompt_content", nullable = false, columnDefinition = "TEXT")
    private String promptContent;

    /**
     * Standard 5-field cron expression
     */
    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    /**
     * Email addresses notified on successful runs
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "job_recipients", joinColumns = @JoinColumn(name = "job_id"))
    @Column(name = "email", nullable = false, length = 255)
    @Builder.Default
    private Set<String> recipients = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (slug == null && name != null) {
            this.slug = slugify(name);
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Rename the job and regenerate its slug
     */
    public void rename(String newName) {
        this.name = newName;
        this.slug = slugify(newName);
    }

    /**
     * "Daily AI News!" becomes "daily-ai-news"
     */
    public static String slugify(String value) {
        var slug = NON_SLUG_CHARS.matcher(value).replaceAll("");
        slug = SEPARATOR_RUNS.matcher(slug).replaceAll("-");
        slug = slug.toLowerCase(Locale.ROOT);
        return slug.replaceAll("^-+|-+$", "");
    }
}
