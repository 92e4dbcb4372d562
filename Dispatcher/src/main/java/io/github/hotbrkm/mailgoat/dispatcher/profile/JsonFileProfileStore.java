package io.github.hotbrkm.mailgoat.dispatcher.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link ProfileStore} backed by a single JSON document.
 * <pre>
 * {
 *   "default_profile": "work",
 *   "profiles": {
 *     "work": {"server": "...", "api_key": "...", "from_address": "...", "from_name": "..."}
 *   }
 * }
 * </pre>
 * A missing file reads as an empty store; the file and its directory are created on first write.
 */
@Slf4j
public class JsonFileProfileStore implements ProfileStore {

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileProfileStore(Path path, ObjectMapper objectMapper) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void add(MailProfile profile, boolean makeDefault) {
        Objects.requireNonNull(profile, "profile must not be null");
        ProfileDocument document = load();
        document.profiles.put(profile.name(), ProfileEntry.from(profile));
        if (makeDefault || document.defaultProfile == null) {
            document.defaultProfile = profile.name();
        }
        save(document);
        log.info("profile={}, event=profile_saved, default={}", profile.name(), profile.name().equals(document.defaultProfile));
    }

    @Override
    public List<MailProfile> list() {
        ProfileDocument document = load();
        List<MailProfile> profiles = new ArrayList<>();
        for (Map.Entry<String, ProfileEntry> e : document.profiles.entrySet()) {
            profiles.add(e.getValue().toProfile(e.getKey()));
        }
        return profiles;
    }

    @Override
    public MailProfile get(String name) {
        if (name == null) {
            throw new ProfileException("profile not found: null");
        }
        ProfileEntry entry = load().profiles.get(name);
        if (entry == null) {
            throw new ProfileException("profile not found: " + name);
        }
        return entry.toProfile(name);
    }

    @Override
    public synchronized void setDefault(String name) {
        ProfileDocument document = load();
        if (name == null || !document.profiles.containsKey(name)) {
            throw new ProfileException("profile not found: " + name);
        }
        document.defaultProfile = name;
        save(document);
        log.info("profile={}, event=default_profile_changed", name);
    }

    @Override
    public Optional<String> defaultProfileName() {
        String value = load().defaultProfile;
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private ProfileDocument load() {
        if (!Files.exists(path)) {
            return new ProfileDocument();
        }
        try {
            ProfileDocument document = objectMapper.readValue(path.toFile(), ProfileDocument.class);
            if (document == null) {
                return new ProfileDocument();
            }
            if (document.profiles == null) {
                document.profiles = new TreeMap<>();
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new ProfileException("profile config must be a JSON object: " + path, e);
        } catch (IOException e) {
            throw new ProfileException("failed to read profile config: " + path, e);
        }
    }

    private void save(ProfileDocument document) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), document);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new ProfileException("failed to write profile config: " + path, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ProfileDocument {
        @JsonProperty("default_profile")
        String defaultProfile;

        @JsonProperty("profiles")
        TreeMap<String, ProfileEntry> profiles = new TreeMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.ALWAYS)
    static class ProfileEntry {
        @JsonProperty("server")
        String server;

        @JsonProperty("api_key")
        String apiKey;

        @JsonProperty("from_address")
        String fromAddress;

        @JsonProperty("from_name")
        String fromName;

        static ProfileEntry from(MailProfile profile) {
            ProfileEntry entry = new ProfileEntry();
            entry.server = profile.server();
            entry.apiKey = profile.apiKey();
            entry.fromAddress = profile.fromAddress();
            entry.fromName = profile.fromName();
            return entry;
        }

        MailProfile toProfile(String name) {
            return new MailProfile(name, server, apiKey, fromAddress, fromName);
        }
    }
}
