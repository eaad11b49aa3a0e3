package com.modsearch.plugins.modrinth.internal;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.modsearch.common.model.Item;
import com.modsearch.common.model.Maturity;
import com.modsearch.common.model.Release;
import com.modsearch.common.model.ReleaseFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps Modrinth JSON objects to the client's model.
 * Missing required fields surface as runtime exceptions, which the gateway reports as malformed responses.
 */
final class ModrinthJsonMapper {
    private static final Logger logger = LoggerFactory.getLogger(ModrinthJsonMapper.class);

    static final String REQUIRED_DEPENDENCY = "required";

    private ModrinthJsonMapper() {
    }

    /**
     * A hit of {@code GET /search}.
     */
    static Item itemFromSearchHit(JsonObject hit) {
        return Item.builder(hit.get("project_id").getAsString(), hit.get("slug").getAsString())
                .kind(string(hit, "project_type", "project"))
                .title(string(hit, "title", ""))
                .author(string(hit, "author", ""))
                .description(string(hit, "description", ""))
                .downloads(number(hit, "downloads"))
                .follows(number(hit, "follows"))
                .categories(strings(hit, "categories"))
                .versions(strings(hit, "versions"))
                .createdAt(timestamp(hit, "date_created"))
                .modifiedAt(timestamp(hit, "date_modified"))
                .license(string(hit, "license", ""))
                .clientSupport(string(hit, "client_side", "unknown"))
                .serverSupport(string(hit, "server_side", "unknown"))
                .build();
    }

    /**
     * The answer of {@code GET /project/{id}}. It has no author and lists loaders separately from categories.
     */
    static Item itemFromProject(JsonObject project) {
        Set<String> categories = new LinkedHashSet<>(strings(project, "categories"));
        categories.addAll(strings(project, "additional_categories"));
        categories.addAll(strings(project, "loaders"));

        String license = "";
        if (project.has("license") && project.get("license").isJsonObject()) {
            license = string(project.getAsJsonObject("license"), "id", "");
        }

        return Item.builder(project.get("id").getAsString(), project.get("slug").getAsString())
                .kind(string(project, "project_type", "project"))
                .title(string(project, "title", ""))
                .description(string(project, "description", ""))
                .downloads(number(project, "downloads"))
                .follows(number(project, "followers"))
                .categories(new ArrayList<>(categories))
                .versions(strings(project, "game_versions"))
                .createdAt(timestamp(project, "published"))
                .modifiedAt(timestamp(project, "updated"))
                .license(license)
                .clientSupport(string(project, "client_side", "unknown"))
                .serverSupport(string(project, "server_side", "unknown"))
                .build();
    }

    /**
     * One element of {@code GET /project/{id}/version}. Only required dependencies that name a project are kept.
     */
    static Release release(JsonObject version) {
        List<ReleaseFile> files = new ArrayList<>();
        JsonArray filesArr = version.getAsJsonArray("files");
        if (filesArr != null) {
            for (JsonElement el : filesArr) {
                files.add(file(el.getAsJsonObject()));
            }
        }

        List<String> dependencyIds = new ArrayList<>();
        JsonArray deps = version.getAsJsonArray("dependencies");
        if (deps != null) {
            for (JsonElement el : deps) {
                JsonObject dep = el.getAsJsonObject();
                String projectId = string(dep, "project_id", null);
                if (REQUIRED_DEPENDENCY.equals(string(dep, "dependency_type", null))
                        && projectId != null && !dependencyIds.contains(projectId)) {
                    dependencyIds.add(projectId);
                }
            }
        }

        return new Release(
                version.get("id").getAsString(),
                Maturity.fromWireName(version.get("version_type").getAsString()),
                string(version, "version_number", ""),
                string(version, "name", ""),
                number(version, "downloads"),
                strings(version, "game_versions"),
                strings(version, "loaders"),
                files,
                dependencyIds);
    }

    static ReleaseFile file(JsonObject file) {
        return new ReleaseFile(
                file.get("url").getAsString(),
                file.get("filename").getAsString(),
                number(file, "size"),
                file.has("primary") && !file.get("primary").isJsonNull() && file.get("primary").getAsBoolean());
    }

    // --- Field helpers ---

    static String string(JsonObject obj, String key, String defaultValue) {
        return obj.has(key) && !obj.get(key).isJsonNull() ? obj.get(key).getAsString() : defaultValue;
    }

    static long number(JsonObject obj, String key) {
        return obj.has(key) && !obj.get(key).isJsonNull() ? obj.get(key).getAsLong() : 0;
    }

    static List<String> strings(JsonObject obj, String key) {
        List<String> values = new ArrayList<>();
        if (obj.has(key) && obj.get(key).isJsonArray()) {
            for (JsonElement el : obj.getAsJsonArray(key)) {
                if (!el.isJsonNull()) values.add(el.getAsString());
            }
        }
        return values;
    }

    static Instant timestamp(JsonObject obj, String key) {
        String value = string(obj, key, null);
        if (value == null) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            logger.warn("Ignoring unparseable timestamp {}='{}': {}", key, value, e.getMessage());
            return null;
        }
    }
}
