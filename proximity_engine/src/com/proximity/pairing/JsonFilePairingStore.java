/*
 * Copyright (C) 2024 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.proximity.pairing;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * {@link PairingStore} backed by a JSON file. Saves go to a temporary file in the same directory
 * which is then moved over the target atomically.
 */
public class JsonFilePairingStore implements PairingStore {
    private static final Logger LOG = LoggerFactory.getLogger(JsonFilePairingStore.class);
    private static final Type LIST_TYPE = new TypeToken<List<PairedDevice>>() {}.getType();

    private final Path mFile;
    private final Gson mGson = new Gson();

    public JsonFilePairingStore(@NonNull Path file) {
        mFile = file.toAbsolutePath();
    }

    @Override
    public @NonNull ImmutableList<PairedDevice> loadPairedDevices() {
        if (!Files.exists(mFile)) {
            return ImmutableList.of();
        }
        try (Reader reader = Files.newBufferedReader(mFile, StandardCharsets.UTF_8)) {
            List<PairedDevice> devices = mGson.fromJson(reader, LIST_TYPE);
            if (devices == null) {
                return ImmutableList.of();
            }
            ImmutableList.Builder<PairedDevice> result = ImmutableList.builder();
            for (PairedDevice device : devices) {
                if (device != null && device.isWellFormed()) {
                    result.add(device);
                } else {
                    LOG.warn("Skipping malformed paired device record in {}", mFile);
                }
            }
            return result.build();
        } catch (IOException | JsonParseException e) {
            LOG.error("Failed to read paired devices from {}", mFile, e);
            return ImmutableList.of();
        }
    }

    @Override
    public void savePairedDevices(@NonNull List<PairedDevice> devices) {
        Path directory = mFile.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, mFile.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                mGson.toJson(devices, LIST_TYPE, writer);
            }
            Files.move(temp, mFile,
                    StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            LOG.debug("Saved {} paired devices to {}", devices.size(), mFile);
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new UncheckedIOException("Failed to save paired devices to " + mFile, e);
        }
    }
}
