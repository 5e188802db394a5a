package com.huntflow.commands;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.huntflow.HuntflowException;
import com.huntflow.session.HuntSession;
import com.huntflow.statement.Command;
import com.huntflow.statement.LoadStatement;
import com.huntflow.store.EntityRows;
import com.huntflow.store.EntityTypeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * LOAD entities from a local JSON or CSV file.
 *
 * <p>JSON files hold an array of entities or an object with an {@code objects} array.
 * CSV files carry a header row; every cell loads as a string.
 */
public class LoadHandler extends AbstractCommandHandler<LoadStatement> {

    private static final Logger log = LoggerFactory.getLogger(LoadHandler.class);

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();

    public LoadHandler(ObjectMapper objectMapper) {
        super(Command.LOAD, LoadStatement.class);
        this.objectMapper = objectMapper;
    }

    @Override
    protected CommandResult doHandle(LoadStatement statement, HuntSession session) {
        File file = new File(statement.getPath());
        List<Map<String, Object>> rows;
        try {
            rows = isCsv(file) ? readCsv(file) : readJson(file);
        } catch (IOException e) {
            log.error("Failed to load {}: {}", file, e.getMessage());
            throw new HuntflowException("cannot load " + file + ": " + e.getMessage(), e);
        }
        String entityType = entityType(statement, rows);
        rows.forEach(row -> row.put(EntityRows.TYPE, entityType));
        log.debug("Loaded {} {} row(s) from {}", rows.size(), entityType, file);
        return bind(session.getStore().insert(entityType, rows), session);
    }

    static boolean isCsv(File file) {
        return file.getName().toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    private List<Map<String, Object>> readJson(File file) throws IOException {
        JsonNode root = objectMapper.readTree(file);
        JsonNode entities = root.isObject() && root.has("objects") ? root.get("objects") : root;
        if (!entities.isArray()) {
            throw new HuntflowException("cannot load " + file + ": expected a JSON array of entities");
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode entity : entities) {
            rows.add(new LinkedHashMap<>(objectMapper.convertValue(entity, ROW_TYPE)));
        }
        return rows;
    }

    private List<Map<String, Object>> readCsv(File file) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, Object>> rows = new ArrayList<>();
        try (MappingIterator<Map<String, Object>> iterator = csvMapper.readerFor(ROW_TYPE).with(schema)
                .readValues(file)) {
            while (iterator.hasNext()) {
                rows.add(new LinkedHashMap<>(iterator.next()));
            }
        }
        return rows;
    }

    /**
     * AS type first, otherwise the {@code type} shared by every loaded entity
     */
    private static String entityType(LoadStatement statement, List<Map<String, Object>> rows) {
        if (statement.getEntityType() != null) {
            return statement.getEntityType();
        }
        String found = null;
        for (Map<String, Object> row : rows) {
            Object type = row.get(EntityRows.TYPE);
            if (type == null || type.toString().isEmpty()) {
                throw new HuntflowException("LOAD " + statement.getPath()
                        + " requires AS <type> when entities carry no \"type\" field");
            }
            if (found != null && !found.equals(type.toString())) {
                throw new EntityTypeMismatchException(found, type.toString());
            }
            found = type.toString();
        }
        if (found == null) {
            throw new HuntflowException("LOAD " + statement.getPath() + " requires AS <type> for an empty file");
        }
        return found;
    }
}
