package webmention.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one source URL referencing one target URL.
 *
 * <p>The triple ({@code source}, {@code target}, {@code direction}) is the logical identity:
 * storing a mention whose identity already exists updates it in place. {@code source} and
 * {@code target} must differ.
 *
 * <p>Instances are never mutated. Status changes and metadata refreshes produce a new value via
 * {@link #toBuilder()} or {@link #withStatus(WebmentionStatus, Instant)}.
 *
 * @see WebmentionDirection
 * @see WebmentionStatus
 */
public final class Webmention {
    private final String source;
    private final String target;
    private final WebmentionDirection direction;
    private final WebmentionStatus status;
    private final MentionType mentionType;
    private final RsvpValue rsvp;
    private final String authorName;
    private final String authorUrl;
    private final String authorPhoto;
    private final String title;
    private final String excerpt;
    private final String content;
    private final Instant published;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Map<String, String> metadata;

    private Webmention(Builder builder) {
        this.source = requireText(builder.source, "source");
        this.target = requireText(builder.target, "target");
        if (source.equals(target)) {
            throw new IllegalArgumentException("source and target must differ: " + source);
        }
        this.direction = Objects.requireNonNull(builder.direction, "direction");
        this.status = builder.status == null ? WebmentionStatus.CONFIRMED : builder.status;
        this.mentionType = builder.mentionType == null ? MentionType.MENTION : builder.mentionType;
        this.rsvp = builder.rsvp;
        this.authorName = builder.authorName;
        this.authorUrl = builder.authorUrl;
        this.authorPhoto = builder.authorPhoto;
        this.title = builder.title;
        this.excerpt = builder.excerpt;
        this.content = builder.content;
        this.published = builder.published;

        Instant now = Instant.now();
        this.createdAt = builder.createdAt == null ? now : builder.createdAt;
        Instant updated = builder.updatedAt == null ? this.createdAt : builder.updatedAt;
        if (updated.isBefore(this.createdAt)) {
            throw new IllegalArgumentException("updatedAt must not be before createdAt");
        }
        this.updatedAt = updated;

        Map<String, String> copy = builder.metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        if (copy.containsKey(null)) {
            throw new IllegalArgumentException("metadata cannot contain null keys");
        }
        if (copy.containsValue(null)) {
            throw new IllegalArgumentException("metadata cannot contain null values");
        }
        this.metadata = copy;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a builder with the identity fields set.
     *
     * @param source    the mentioning URL
     * @param target    the mentioned URL
     * @param direction whether the mention was received or sent
     * @return a new builder
     */
    public static Builder builder(String source, String target, WebmentionDirection direction) {
        return new Builder().source(source).target(target).direction(direction);
    }

    public String source() {
        return source;
    }

    public String target() {
        return target;
    }

    public WebmentionDirection direction() {
        return direction;
    }

    public WebmentionStatus status() {
        return status;
    }

    public MentionType mentionType() {
        return mentionType;
    }

    /**
     * Returns the rsvp answer, only set when {@link #mentionType()} is {@link MentionType#RSVP}.
     *
     * @return the rsvp value, or {@code null}
     */
    public RsvpValue rsvp() {
        return rsvp;
    }

    public String authorName() {
        return authorName;
    }

    public String authorUrl() {
        return authorUrl;
    }

    public String authorPhoto() {
        return authorPhoto;
    }

    public String title() {
        return title;
    }

    public String excerpt() {
        return excerpt;
    }

    public String content() {
        return content;
    }

    public Instant published() {
        return published;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public boolean isVisible() {
        return status == WebmentionStatus.CONFIRMED;
    }

    /**
     * Returns {@code true} if both mentions share ({@code source}, {@code target}, {@code direction}).
     *
     * @param other the mention to compare against
     * @return whether the identities match
     */
    public boolean sameIdentity(Webmention other) {
        return other != null
                && source.equals(other.source)
                && target.equals(other.target)
                && direction == other.direction;
    }

    /**
     * Compares everything except the timestamps. Used to decide whether a re-fetched
     * source actually changed anything worth persisting.
     *
     * @param other the mention to compare against
     * @return {@code true} if no stored field other than the timestamps differs
     */
    public boolean sameContent(Webmention other) {
        return sameIdentity(other)
                && status == other.status
                && mentionType == other.mentionType
                && rsvp == other.rsvp
                && Objects.equals(authorName, other.authorName)
                && Objects.equals(authorUrl, other.authorUrl)
                && Objects.equals(authorPhoto, other.authorPhoto)
                && Objects.equals(title, other.title)
                && Objects.equals(excerpt, other.excerpt)
                && Objects.equals(content, other.content)
                && Objects.equals(published, other.published)
                && metadata.equals(other.metadata);
    }

    /**
     * Returns a copy with a new status and {@code updatedAt}.
     *
     * @param status    the new status
     * @param updatedAt the mutation time, clamped to {@code createdAt}
     * @return the updated copy
     */
    public Webmention withStatus(WebmentionStatus status, Instant updatedAt) {
        Objects.requireNonNull(status, "status");
        Instant at = updatedAt == null || updatedAt.isBefore(createdAt) ? createdAt : updatedAt;
        return toBuilder().status(status).updatedAt(at).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .source(source)
                .target(target)
                .direction(direction)
                .status(status)
                .mentionType(mentionType)
                .rsvp(rsvp)
                .authorName(authorName)
                .authorUrl(authorUrl)
                .authorPhoto(authorPhoto)
                .title(title)
                .excerpt(excerpt)
                .content(content)
                .published(published)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .metadata(metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Webmention other)) {
            return false;
        }
        return sameContent(other)
                && createdAt.equals(other.createdAt)
                && updatedAt.equals(other.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, direction, status, updatedAt);
    }

    @Override
    public String toString() {
        return "Webmention{source=" + source
                + ", target=" + target
                + ", direction=" + direction
                + ", status=" + status
                + ", type=" + mentionType + '}';
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be empty");
        }
        return value;
    }

    /**
     * Builder for {@link Webmention}.
     */
    public static final class Builder {
        private String source;
        private String target;
        private WebmentionDirection direction;
        private WebmentionStatus status;
        private MentionType mentionType;
        private RsvpValue rsvp;
        private String authorName;
        private String authorUrl;
        private String authorPhoto;
        private String title;
        private String excerpt;
        private String content;
        private Instant published;
        private Instant createdAt;
        private Instant updatedAt;
        private Map<String, String> metadata;

        private Builder() {
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder direction(WebmentionDirection direction) {
            this.direction = direction;
            return this;
        }

        /**
         * Sets the moderation status.
         *
         * <p>Optional. Defaults to {@link WebmentionStatus#CONFIRMED}.
         *
         * @param status the status
         * @return this builder
         */
        public Builder status(WebmentionStatus status) {
            this.status = status;
            return this;
        }

        /**
         * Sets the classification.
         *
         * <p>Optional. Defaults to {@link MentionType#MENTION}.
         *
         * @param mentionType the type
         * @return this builder
         */
        public Builder mentionType(MentionType mentionType) {
            this.mentionType = mentionType;
            return this;
        }

        public Builder rsvp(RsvpValue rsvp) {
            this.rsvp = rsvp;
            return this;
        }

        public Builder authorName(String authorName) {
            this.authorName = authorName;
            return this;
        }

        public Builder authorUrl(String authorUrl) {
            this.authorUrl = authorUrl;
            return this;
        }

        public Builder authorPhoto(String authorPhoto) {
            this.authorPhoto = authorPhoto;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder excerpt(String excerpt) {
            this.excerpt = excerpt;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder published(Instant published) {
            this.published = published;
            return this;
        }

        /**
         * Sets the first-persistence time.
         *
         * <p>Optional. Defaults to {@link Instant#now()}.
         *
         * @param createdAt the creation time
         * @return this builder
         */
        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /**
         * Sets the last-mutation time.
         *
         * <p>Optional. Defaults to {@code createdAt}. Must not be before it.
         *
         * @param updatedAt the update time
         * @return this builder
         */
        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        /**
         * Sets the opaque metadata map. Copied at build time; null keys and values are rejected.
         *
         * @param metadata the metadata
         * @return this builder
         */
        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Builds an immutable {@link Webmention}.
         *
         * @return a new mention
         * @throws IllegalArgumentException if source equals target, a URL is blank,
         *                                  updatedAt precedes createdAt or metadata holds nulls
         * @throws NullPointerException     if source, target or direction is missing
         */
        public Webmention build() {
            return new Webmention(this);
        }
    }
}
