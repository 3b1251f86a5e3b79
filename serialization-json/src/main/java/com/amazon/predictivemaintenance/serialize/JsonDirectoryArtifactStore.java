/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.predictivemaintenance.serialize;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;
import static com.amazon.predictivemaintenance.CommonUtils.checkState;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.predictivemaintenance.ITrainedModel;
import com.amazon.predictivemaintenance.store.ArtifactKey;
import com.amazon.predictivemaintenance.store.ArtifactStore;
import com.amazon.predictivemaintenance.store.ModelArtifact;

/**
 * An {@link ArtifactStore} keeping one JSON file per artifact version under a
 * root directory:
 * {@code <root>/<kind>/<equipmentClass>[/<equipmentId>]/v<version>.json}. Path
 * segments are URL encoded, with the dots of {@code .} and {@code ..} escaped
 * as well, so every key stays below the root. A file is written to a temporary name and then
 * moved into place, so readers never see a partial artifact.
 */
@Slf4j
public class JsonDirectoryArtifactStore implements ArtifactStore {

    static final String PREFIX = "v";

    static final String SUFFIX = ".json";

    @Getter
    private final Path root;

    private final ModelArtifactSerDe serDe;

    public JsonDirectoryArtifactStore(Path root) {
        this(root, new ModelArtifactSerDe());
    }

    public JsonDirectoryArtifactStore(Path root, ModelArtifactSerDe serDe) {
        this.root = checkNotNull(root, "root must not be null");
        this.serDe = checkNotNull(serDe, "serDe must not be null");
    }

    @Override
    public Optional<ModelArtifact<? extends ITrainedModel>> loadLatest(ArtifactKey key) {
        List<Long> versions = versions(key);
        if (versions.isEmpty()) {
            return Optional.empty();
        }
        return load(key, versions.get(versions.size() - 1));
    }

    @Override
    public Optional<ModelArtifact<? extends ITrainedModel>> load(ArtifactKey key, long version) {
        Path file = directoryOf(key).resolve(PREFIX + version + SUFFIX);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(serDe.fromJson(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + file, e);
        }
    }

    @Override
    public List<Long> versions(ArtifactKey key) {
        Path directory = directoryOf(key);
        List<Long> versions = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return versions;
        }
        try (Stream<Path> files = Files.list(directory)) {
            files.map(path -> path.getFileName().toString()).filter(JsonDirectoryArtifactStore::isArtifactFile)
                    .forEach(name -> versions.add(parseVersion(name)));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list " + directory, e);
        }
        Collections.sort(versions);
        return versions;
    }

    @Override
    public synchronized void publish(ModelArtifact<? extends ITrainedModel> artifact) {
        checkNotNull(artifact, "artifact must not be null");
        List<Long> versions = versions(artifact.getKey());
        checkState(versions.isEmpty() || versions.get(versions.size() - 1) < artifact.getVersion(),
                "version " + artifact.getVersion() + " of " + artifact.getKey() + " is not new");
        Path directory = directoryOf(artifact.getKey());
        Path target = directory.resolve(PREFIX + artifact.getVersion() + SUFFIX);
        try {
            Files.createDirectories(directory);
            Path temporary = Files.createTempFile(directory, ".publish", ".tmp");
            Files.writeString(temporary, serDe.toJson(artifact), StandardCharsets.UTF_8);
            Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write " + target, e);
        }
        log.info("wrote {} to {}", artifact, target);
    }

    Path directoryOf(ArtifactKey key) {
        Path directory = root.resolve(key.getModelKind().name()).resolve(encode(key.getEquipmentClass()));
        if (key.getEquipmentId().isPresent()) {
            directory = directory.resolve(encode(key.getEquipmentId().get()));
        }
        return directory;
    }

    static boolean isArtifactFile(String name) {
        if (!name.startsWith(PREFIX) || !name.endsWith(SUFFIX)) {
            return false;
        }
        String digits = name.substring(PREFIX.length(), name.length() - SUFFIX.length());
        return !digits.isEmpty() && digits.chars().allMatch(Character::isDigit);
    }

    static long parseVersion(String name) {
        return Long.parseLong(name.substring(PREFIX.length(), name.length() - SUFFIX.length()));
    }

    static String encode(String segment) {
        checkArgument(!segment.isEmpty(), "path segments must not be empty");
        String encoded = URLEncoder.encode(segment, StandardCharsets.UTF_8);
        if (encoded.equals(".") || encoded.equals("..")) {
            return encoded.replace(".", "%2E");
        }
        return encoded;
    }
}
