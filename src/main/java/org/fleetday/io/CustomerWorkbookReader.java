package org.fleetday.io;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.fleetday.ledger.Customer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads customers from the first sheet of an Excel workbook.
 *
 * <p>The first non-empty row is the header. Required columns, matched case-insensitively
 * and in any order: {@value #COLUMN_ID}, {@value #COLUMN_X}, {@value #COLUMN_Y},
 * {@value #COLUMN_WEIGHT}. The Spanish headers of the legacy {@code clientes.xlsx} layout
 * ({@code Cliente ID}, {@code Coordenada X}, {@code Coordenada Y}, {@code Peso (kg)}) are
 * accepted as aliases. Rows where all four cells are blank are skipped. Numeric ids
 * without a fractional part are read as integers ({@code 7.0} becomes {@code "7"}).</p>
 */
@Slf4j
public final class CustomerWorkbookReader {
    public static final String COLUMN_ID = "Customer ID";
    public static final String COLUMN_X = "X";
    public static final String COLUMN_Y = "Y";
    public static final String COLUMN_WEIGHT = "Weight (kg)";

    private static final Map<String, List<String>> COLUMN_ALIASES = columnAliases();

    private final DataFormatter formatter = new DataFormatter(Locale.ROOT);

    /**
     * Reads customers from a workbook file.
     *
     * @param path {@code .xlsx} or {@code .xls} file.
     * @return customers in row order.
     * @throws IOException when the file cannot be read.
     * @throws WorkbookFormatException when the layout or a cell value is invalid.
     */
    public List<Customer> read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            List<Customer> customers = read(in);
            log.info("Loaded {} customers from {}", customers.size(), path);
            return customers;
        }
    }

    /**
     * Reads customers from a workbook stream. The stream is not closed.
     */
    public List<Customer> read(InputStream in) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new WorkbookFormatException(0, "workbook has no sheets");
            }
            return readSheet(workbook.getSheetAt(0));
        }
    }

    private List<Customer> readSheet(Sheet sheet) {
        Row header = sheet.getRow(sheet.getFirstRowNum());
        if (header == null) {
            throw new WorkbookFormatException(0, "sheet '" + sheet.getSheetName() + "' is empty");
        }
        Map<String, Integer> columns = mapColumns(header);

        int idColumn = columns.get(COLUMN_ID);
        int xColumn = columns.get(COLUMN_X);
        int yColumn = columns.get(COLUMN_Y);
        int weightColumn = columns.get(COLUMN_WEIGHT);

        List<Customer> customers = new ArrayList<>();
        for (int r = header.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            int rowNumber = r + 1;
            if (isBlank(row, idColumn, xColumn, yColumn, weightColumn)) {
                continue;
            }
            customers.add(Customer.of(
                    readId(row.getCell(idColumn), rowNumber),
                    readNumber(row.getCell(xColumn), COLUMN_X, rowNumber),
                    readNumber(row.getCell(yColumn), COLUMN_Y, rowNumber),
                    readNumber(row.getCell(weightColumn), COLUMN_WEIGHT, rowNumber)
            ));
        }
        return customers;
    }

    private Map<String, Integer> mapColumns(Row header) {
        Map<String, Integer> byName = new HashMap<>();
        for (Cell cell : header) {
            String name = formatter.formatCellValue(cell).trim().toLowerCase(Locale.ROOT);
            if (!name.isEmpty()) {
                byName.putIfAbsent(name, cell.getColumnIndex());
            }
        }
        Map<String, Integer> columns = new HashMap<>();
        for (Map.Entry<String, List<String>> required : COLUMN_ALIASES.entrySet()) {
            Integer index = null;
            for (String alias : required.getValue()) {
                index = byName.get(alias.toLowerCase(Locale.ROOT));
                if (index != null) {
                    break;
                }
            }
            if (index == null) {
                throw new WorkbookFormatException(
                        header.getRowNum() + 1,
                        "missing column '" + required.getKey() + "' (accepted: " + required.getValue()
                                + "), found " + byName.keySet()
                );
            }
            columns.put(required.getKey(), index);
        }
        return columns;
    }

    private static Map<String, List<String>> columnAliases() {
        Map<String, List<String>> aliases = new LinkedHashMap<>();
        aliases.put(COLUMN_ID, List.of(COLUMN_ID, "Cliente ID"));
        aliases.put(COLUMN_X, List.of(COLUMN_X, "Coordenada X"));
        aliases.put(COLUMN_Y, List.of(COLUMN_Y, "Coordenada Y"));
        aliases.put(COLUMN_WEIGHT, List.of(COLUMN_WEIGHT, "Peso (kg)"));
        return Collections.unmodifiableMap(aliases);
    }

    private boolean isBlank(Row row, int... columns) {
        if (row == null) {
            return true;
        }
        for (int column : columns) {
            Cell cell = row.getCell(column);
            if (cell != null && !formatter.formatCellValue(cell).isBlank()) {
                return false;
            }
        }
        return true;
    }

    private String readId(Cell cell, int rowNumber) {
        if (cell != null && resolvedType(cell) == CellType.NUMERIC) {
            double value = cell.getNumericCellValue();
            if (value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
        String text = cell == null ? "" : formatter.formatCellValue(cell).trim();
        if (text.isEmpty()) {
            throw new WorkbookFormatException(rowNumber, "'" + COLUMN_ID + "' is blank");
        }
        return text;
    }

    private double readNumber(Cell cell, String column, int rowNumber) {
        if (cell == null) {
            throw new WorkbookFormatException(rowNumber, "'" + column + "' is blank");
        }
        CellType type = resolvedType(cell);
        if (type == CellType.NUMERIC) {
            return cell.getNumericCellValue();
        }
        if (type == CellType.STRING) {
            String text = cell.getStringCellValue().trim();
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException ex) {
                throw new WorkbookFormatException(rowNumber, "'" + column + "' is not a number: '" + text + "'");
            }
        }
        throw new WorkbookFormatException(rowNumber, "'" + column + "' has unsupported cell type " + type);
    }

    private static CellType resolvedType(Cell cell) {
        CellType type = cell.getCellType();
        return type == CellType.FORMULA ? cell.getCachedFormulaResultType() : type;
    }
}
