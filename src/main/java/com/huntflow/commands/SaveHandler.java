package com.huntflow.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.huntflow.HuntflowException;
import com.huntflow.session.HuntSession;
import com.huntflow.session.VariableBinding;
import com.huntflow.statement.Command;
import com.huntflow.statement.SaveStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SAVE a variable to a local JSON or CSV file, chosen by extension
 */
public class SaveHandler extends AbstractCommandHandler<SaveStatement> {

    private static final Logger log = LoggerFactory.getLogger(SaveHandler.class);

    static final String CSV_LIST_SEPARATOR = ";";

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();

    public SaveHandler(ObjectMapper objectMapper) {
        super(Command.SAVE, SaveStatement.class);
        this.objectMapper = objectMapper;
    }

    @Override
    protected CommandResult doHandle(SaveStatement statement, HuntSession session) {
        VariableBinding binding = session.getSymbolTable().require(statement.getInput());
        List<Map<String, Object>> rows = binding.getRows();
        File file = new File(statement.getPath());
        try {
            if (file.getParentFile() != null) {
                Files.createDirectories(file.getParentFile().toPath());
            }
            if (LoadHandler.isCsv(file)) {
                writeCsv(file, rows);
            } else {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, rows);
            }
        } catch (IOException e) {
            log.error("Failed to save {} to {}: {}", statement.getInput(), file, e.getMessage());
            throw new HuntflowException("cannot save " + statement.getInput() + " to " + file + ": "
                    + e.getMessage(), e);
        }
        log.debug("Saved {} row(s) of {} to {}", rows.size(), statement.getInput(), file);
        return CommandResult.empty();
    }

    private void writeCsv(File file, List<Map<String, Object>> rows) throws IOException {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        columns.forEach(schema::addColumn);

        List<Map<String, Object>> cells = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> flat = new LinkedHashMap<>();
            for (String column : columns) {
                flat.put(column, toCell(row.get(column)));
            }
            cells.add(flat);
        }
        csvMapper.writer(schema.build()).writeValue(file, cells);
    }

    private static Object toCell(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().map(String::valueOf).collect(Collectors.joining(CSV_LIST_SEPARATOR));
        }
        return value;
    }
}
