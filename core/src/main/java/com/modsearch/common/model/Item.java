package com.modsearch.common.model;

import com.modsearch.core.query.FilterVocabulary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A searchable project (mod, resource pack, shader, ...).
 * Category tags are split once, at construction, into loader tags and topic tags.
 */
public final class Item {
    private final String id;
    private final String slug;
    private final String kind;
    private final String title;
    private final String author;
    private final String description;
    private final long downloads;
    private final long follows;
    private final List<String> categories;
    private final List<String> versions;
    private final Instant createdAt;
    private final Instant modifiedAt;
    private final String license;
    private final String clientSupport;
    private final String serverSupport;

    private final List<String> loaders;
    private final List<String> topics;

    private Item(Builder b) {
        this.id = b.id;
        this.slug = b.slug;
        this.kind = b.kind;
        this.title = b.title == null ? "" : b.title;
        this.author = b.author == null ? "" : b.author;
        this.description = b.description == null ? "" : b.description;
        this.downloads = b.downloads;
        this.follows = b.follows;
        this.categories = List.copyOf(b.categories);
        this.versions = List.copyOf(b.versions);
        this.createdAt = b.createdAt;
        this.modifiedAt = b.modifiedAt;
        this.license = b.license == null ? "" : b.license;
        this.clientSupport = b.clientSupport;
        this.serverSupport = b.serverSupport;

        List<String> loaderTags = new ArrayList<>();
        List<String> topicTags = new ArrayList<>();
        for (String category : categories) {
            if (FilterVocabulary.isLoader(category)) {
                loaderTags.add(category);
            } else {
                topicTags.add(category);
            }
        }
        this.loaders = Collections.unmodifiableList(loaderTags);
        this.topics = Collections.unmodifiableList(topicTags);
    }

    public static Builder builder(String id, String slug) {
        return new Builder(id, slug);
    }

    public String getId() {
        return id;
    }

    public String getSlug() {
        return slug;
    }

    public String getKind() {
        return kind;
    }

    public String getTitle() {
        return title;
    }

    public String getAuthor() {
        return author;
    }

    public String getDescription() {
        return description;
    }

    public long getDownloads() {
        return downloads;
    }

    public long getFollows() {
        return follows;
    }

    public List<String> getCategories() {
        return categories;
    }

    /**
     * Supported target versions as sent by the API (oldest first). May be empty.
     */
    public List<String> getVersions() {
        return versions;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getModifiedAt() {
        return modifiedAt;
    }

    public String getLicense() {
        return license;
    }

    public String getClientSupport() {
        return clientSupport;
    }

    public String getServerSupport() {
        return serverSupport;
    }

    public List<String> getLoaders() {
        return loaders;
    }

    public List<String> getTopics() {
        return topics;
    }

    @Override
    public String toString() {
        return "Item(" + id + ", " + slug + ", " + kind + ", " + title + ", ...)";
    }

    public static final class Builder {
        private final String id;
        private final String slug;
        private String kind = "project";
        private String title = "";
        private String author = "";
        private String description = "";
        private long downloads;
        private long follows;
        private List<String> categories = List.of();
        private List<String> versions = List.of();
        private Instant createdAt;
        private Instant modifiedAt;
        private String license = "";
        private String clientSupport = "unknown";
        private String serverSupport = "unknown";

        private Builder(String id, String slug) {
            this.id = id;
            this.slug = slug;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder downloads(long downloads) {
            this.downloads = downloads;
            return this;
        }

        public Builder follows(long follows) {
            this.follows = follows;
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories = categories;
            return this;
        }

        public Builder versions(List<String> versions) {
            this.versions = versions;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder modifiedAt(Instant modifiedAt) {
            this.modifiedAt = modifiedAt;
            return this;
        }

        public Builder license(String license) {
            this.license = license;
            return this;
        }

        public Builder clientSupport(String clientSupport) {
            this.clientSupport = clientSupport;
            return this;
        }

        public Builder serverSupport(String serverSupport) {
            this.serverSupport = serverSupport;
            return this;
        }

        public Item build() {
            return new Item(this);
        }
    }
}
