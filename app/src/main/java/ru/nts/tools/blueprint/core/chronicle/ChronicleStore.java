/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.blueprint.core.chronicle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.blueprint.core.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Чтение и запись файла хроники (scaffold.lock).
 *
 * Формат: JSON с отсортированными ключами и отступом в два пробела.
 * Испорченный файл (невалидный JSON, неверная структура, несовпадение печати)
 * переименовывается в {@code <имя>.corrupt-<epochMillis>}, а история считается пустой.
 */
public class ChronicleStore {

    public static final String CORRUPT_SUFFIX = ".corrupt-";

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Результат загрузки: хроника и, если файл был испорчен, предупреждение.
     *
     * @param chronicle загруженная (или пустая) хроника
     * @param warning   диагностика порчи или null
     * @param backup    куда отложен испорченный файл (или null)
     */
    public record LoadResult(Chronicle chronicle, Diagnostic warning, Path backup) {
        public boolean isCorrupted() {
            return warning != null;
        }
    }

    public LoadResult load(Path file) {
        return load(file, true);
    }

    /**
     * @param quarantine откладывать испорченный файл в резервную копию (false для пробного прогона)
     */
    public LoadResult load(Path file, boolean quarantine) {
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            return new LoadResult(Chronicle.empty(), null, null);
        }
        String problem;
        try {
            String json = new String(FileUtils.safeReadAllBytes(file), StandardCharsets.UTF_8);
            Chronicle chronicle = parse(mapper.readTree(json));
            if (chronicle.isIntact()) {
                return new LoadResult(chronicle, null, null);
            }
            problem = "integrity seal mismatch";
        } catch (IOException e) {
            problem = "unreadable JSON: " + e.getMessage();
        } catch (IllegalArgumentException e) {
            problem = e.getMessage();
        }
        if (!quarantine) {
            String message = "Chronicle " + file.getFileName() + " is corrupted (" + problem + "); history treated as empty";
            EngineLog.warn(message);
            return new LoadResult(Chronicle.empty(), Diagnostic.warning(0, "CHRONICLE_CORRUPTED", message, null), null);
        }
        return quarantine(file, problem);
    }

    private LoadResult quarantine(Path file, String problem) {
        Path backup = file.resolveSibling(file.getFileName() + CORRUPT_SUFFIX + System.currentTimeMillis());
        String message = "Chronicle " + file.getFileName() + " is corrupted (" + problem + "); history reset";
        try {
            FileUtils.safeMove(file, backup);
            message += ", backup kept at " + backup.getFileName();
        } catch (IOException e) {
            EngineLog.error("Cannot back up corrupted chronicle " + file + ": " + e.getMessage());
            backup = null;
        }
        EngineLog.warn(message);
        return new LoadResult(Chronicle.empty(), Diagnostic.warning(0, "CHRONICLE_CORRUPTED", message, null), backup);
    }

    /**
     * Атомарно сохраняет хронику (временный файл + перемещение).
     *
     * @throws BlueprintException CHRONICLE_UNWRITABLE при сбое записи
     */
    public void save(Path file, Chronicle chronicle) {
        try {
            byte[] bytes = (mapper.writeValueAsString(toJson(chronicle)) + "\n").getBytes(StandardCharsets.UTF_8);
            FileUtils.safeWrite(file, bytes);
        } catch (IOException e) {
            throw new BlueprintException(BlueprintErrorCode.CHRONICLE_UNWRITABLE, Map.of("path", file), e);
        }
    }

    // ==================== JSON mapping ====================

    // Ключи добавляются в алфавитном порядке: ObjectNode сохраняет порядок вставки
    ObjectNode toJson(Chronicle chronicle) {
        ObjectNode root = mapper.createObjectNode();
        root.put("chronicleVersion", chronicle.version());

        ObjectNode integrity = root.putObject("integrity");
        integrity.put("algorithm", IntegritySeal.ALGORITHM);
        integrity.put("seal", chronicle.seal());

        ObjectNode manifest = root.putObject("manifest");
        chronicle.manifest().entries().forEach((path, entry) -> {
            ObjectNode node = manifest.putObject(path);
            node.put("directory", entry.directory());
            if (entry.hash() != null) node.put("hash", entry.hash());
            else node.putNull("hash");
            if (entry.permission() != null) node.put("permission", entry.permission());
            else node.putNull("permission");
            node.put("size", entry.size());
        });

        Provenance p = chronicle.provenance();
        if (p != null) {
            ObjectNode provenance = root.putObject("provenance");
            if (p.blueprint() != null) provenance.put("blueprint", p.blueprint());
            else provenance.putNull("blueprint");
            ObjectNode counts = provenance.putObject("counts");
            p.counts().forEach(counts::put);
            provenance.put("runId", p.runId());
            provenance.put("timestamp", p.timestamp().toString());
        } else {
            root.putNull("provenance");
        }
        return root;
    }

    /**
     * @throws IllegalArgumentException если структура не соответствует формату
     */
    Chronicle parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("root is not an object");
        }
        JsonNode version = root.get("chronicleVersion");
        if (version == null || !version.isInt()) {
            throw new IllegalArgumentException("missing chronicleVersion");
        }
        if (version.asInt() > Chronicle.CURRENT_VERSION) {
            throw new IllegalArgumentException("unsupported chronicleVersion " + version.asInt());
        }
        JsonNode manifestNode = root.get("manifest");
        if (manifestNode == null || !manifestNode.isObject()) {
            throw new IllegalArgumentException("missing manifest");
        }
        Map<String, ManifestEntry> entries = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = manifestNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            if (!node.isObject()) {
                throw new IllegalArgumentException("manifest entry '" + field.getKey() + "' is not an object");
            }
            boolean directory = node.path("directory").asBoolean(false);
            String hash = textOrNull(node.get("hash"));
            if (!directory && hash == null) {
                throw new IllegalArgumentException("file entry '" + field.getKey() + "' has no hash");
            }
            entries.put(field.getKey(), new ManifestEntry(hash, node.path("size").asLong(0),
                    textOrNull(node.get("permission")), directory));
        }

        JsonNode integrity = root.get("integrity");
        String seal = integrity == null ? null : textOrNull(integrity.get("seal"));
        if (seal == null) {
            throw new IllegalArgumentException("missing integrity seal");
        }

        Provenance provenance = null;
        JsonNode p = root.get("provenance");
        if (p != null && p.isObject()) {
            Map<String, Integer> counts = new TreeMap<>();
            p.path("counts").fields().forEachRemaining(e -> counts.put(e.getKey(), e.getValue().asInt()));
            Instant timestamp;
            try {
                timestamp = Instant.parse(p.path("timestamp").asText());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("bad provenance timestamp");
            }
            provenance = new Provenance(p.path("runId").asText(), timestamp, textOrNull(p.get("blueprint")), counts);
        }
        return new Chronicle(version.asInt(), provenance, ChronicleManifest.of(entries), seal);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
