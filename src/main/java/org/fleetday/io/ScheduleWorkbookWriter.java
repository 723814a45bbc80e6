package org.fleetday.io;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.fleetday.scheduling.DailyMetricRecord;
import org.fleetday.scheduling.DeliveryRecord;
import org.fleetday.scheduling.DeliverySchedule;
import org.fleetday.scheduling.VehicleRoute;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Writes a {@link DeliverySchedule} as an Excel report with three sheets.
 *
 * <ul>
 * <li>{@value #SHEET_DELIVERIES}: one row per delivery, sorted by day, vehicle, arrival.</li>
 * <li>{@value #SHEET_METRICS}: one row per vehicle and day, sorted by day, vehicle.</li>
 * <li>{@value #SHEET_ROUTES}: the closed stop sequence of every vehicle and day.</li>
 * </ul>
 */
@Slf4j
public final class ScheduleWorkbookWriter {
    public static final String SHEET_DELIVERIES = "Deliveries";
    public static final String SHEET_METRICS = "Metrics";
    public static final String SHEET_ROUTES = "Routes";

    static final String[] DELIVERY_HEADERS = {
            "day", "vehicle", "customer", "arrival_min", "departure_min", "leg_km"
    };
    static final String[] METRIC_HEADERS = {
            "day", "vehicle", "distance_km", "time_min", "deliveries", "reloads", "workday_exceeded"
    };
    static final String[] ROUTE_HEADERS = {"day", "vehicle", "stops"};

    private static final String ROUTE_SEPARATOR = " -> ";
    private static final int COLUMN_WIDTH_CHARS = 16;

    /**
     * Writes the report to a file, replacing any existing content.
     *
     * @param schedule schedule to report.
     * @param path target {@code .xlsx} file.
     * @throws IOException when the file cannot be written.
     */
    public void write(DeliverySchedule schedule, Path path) throws IOException {
        try (Workbook workbook = toWorkbook(schedule);
             OutputStream out = Files.newOutputStream(path)) {
            workbook.write(out);
        }
        log.info("Wrote {} deliveries and {} metric rows to {}",
                schedule.getDeliveries().size(), schedule.getMetrics().size(), path);
    }

    /**
     * Builds the report workbook in memory. The caller closes it.
     */
    public Workbook toWorkbook(DeliverySchedule schedule) {
        Workbook workbook = new XSSFWorkbook();
        Styles styles = new Styles(workbook);
        writeDeliveries(workbook.createSheet(SHEET_DELIVERIES), schedule, styles);
        writeMetrics(workbook.createSheet(SHEET_METRICS), schedule, styles);
        writeRoutes(workbook.createSheet(SHEET_ROUTES), schedule, styles);
        return workbook;
    }

    private static void writeDeliveries(Sheet sheet, DeliverySchedule schedule, Styles styles) {
        writeHeader(sheet, DELIVERY_HEADERS, styles);
        List<DeliveryRecord> sorted = new ArrayList<>(schedule.getDeliveries());
        sorted.sort(Comparator.comparingInt(DeliveryRecord::getDay)
                .thenComparingInt(DeliveryRecord::getVehicleId)
                .thenComparingDouble(DeliveryRecord::getArrivalMinute));
        int rowIndex = 1;
        for (DeliveryRecord record : sorted) {
            Row row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(record.getDay());
            row.createCell(1).setCellValue(record.getVehicleId());
            row.createCell(2).setCellValue(record.getCustomerId());
            writeNumber(row, 3, record.getArrivalMinute(), styles.oneDecimal);
            writeNumber(row, 4, record.getDepartureMinute(), styles.oneDecimal);
            writeNumber(row, 5, record.getLegDistanceKm(), styles.twoDecimals);
        }
    }

    private static void writeMetrics(Sheet sheet, DeliverySchedule schedule, Styles styles) {
        writeHeader(sheet, METRIC_HEADERS, styles);
        List<DailyMetricRecord> sorted = new ArrayList<>(schedule.getMetrics());
        sorted.sort(Comparator.comparingInt(DailyMetricRecord::getDay)
                .thenComparingInt(DailyMetricRecord::getVehicleId));
        int rowIndex = 1;
        for (DailyMetricRecord record : sorted) {
            Row row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(record.getDay());
            row.createCell(1).setCellValue(record.getVehicleId());
            writeNumber(row, 2, record.getDistanceKm(), styles.twoDecimals);
            writeNumber(row, 3, record.getDutyMinutes(), styles.oneDecimal);
            row.createCell(4).setCellValue(record.getDeliveryCount());
            row.createCell(5).setCellValue(record.getReloadCount());
            row.createCell(6).setCellValue(record.isWorkdayExceeded());
        }
    }

    private static void writeRoutes(Sheet sheet, DeliverySchedule schedule, Styles styles) {
        writeHeader(sheet, ROUTE_HEADERS, styles);
        int rowIndex = 1;
        for (VehicleRoute route : schedule.getRoutes()) {
            Row row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(route.getDay());
            row.createCell(1).setCellValue(route.getVehicleId());
            row.createCell(2).setCellValue(String.join(ROUTE_SEPARATOR, route.getStopIds()));
        }
        sheet.setColumnWidth(2, COLUMN_WIDTH_CHARS * 4 * 256);
    }

    private static void writeHeader(Sheet sheet, String[] headers, Styles styles) {
        Row header = sheet.createRow(0);
        for (int c = 0; c < headers.length; c++) {
            Cell cell = header.createCell(c);
            cell.setCellValue(headers[c]);
            cell.setCellStyle(styles.header);
            sheet.setColumnWidth(c, COLUMN_WIDTH_CHARS * 256);
        }
        sheet.createFreezePane(0, 1);
    }

    private static void writeNumber(Row row, int column, double value, CellStyle style) {
        Cell cell = row.createCell(column);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }

    /**
     * Cell styles shared by all sheets of one workbook.
     */
    private static final class Styles {
        private final CellStyle header;
        private final CellStyle oneDecimal;
        private final CellStyle twoDecimals;

        private Styles(Workbook workbook) {
            DataFormat format = workbook.createDataFormat();
            Font bold = workbook.createFont();
            bold.setBold(true);

            this.header = workbook.createCellStyle();
            this.header.setFont(bold);
            this.oneDecimal = workbook.createCellStyle();
            this.oneDecimal.setDataFormat(format.getFormat("0.0"));
            this.twoDecimals = workbook.createCellStyle();
            this.twoDecimals.setDataFormat(format.getFormat("0.00"));
        }
    }
}
