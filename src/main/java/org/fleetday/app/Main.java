package org.fleetday.app;

import lombok.extern.slf4j.Slf4j;
import org.fleetday.io.CustomerWorkbookReader;
import org.fleetday.io.ScheduleWorkbookWriter;
import org.fleetday.io.WorkbookFormatException;
import org.fleetday.ledger.Customer;
import org.fleetday.scheduling.DeliveryPlanner;
import org.fleetday.scheduling.DeliverySchedule;
import org.fleetday.scheduling.SchedulerConfig;
import org.fleetday.scheduling.SchedulingException;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line entry point: reads customers, plans all days, writes the report.
 *
 * <pre>
 * java -Dfleetday.scheduler.fleetSize=6 org.fleetday.app.Main customers.xlsx [report.xlsx]
 * </pre>
 *
 * <p>Scheduler parameters come from {@code fleetday.scheduler.*} system properties
 * (see {@link SchedulerConfig}).</p>
 */
@Slf4j
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    static final String DEFAULT_REPORT = "delivery-report.xlsx";

    /**
     * Launches the planner.
     *
     * @param args customer workbook path and optional report path.
     */
    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs one planning pass and returns the process exit status.
     */
    static int run(String... args) {
        if (args == null || args.length < 1 || args.length > 2) {
            log.error("usage: Main <customers.xlsx> [report.xlsx]");
            return EXIT_USAGE;
        }
        Path input = Paths.get(args[0]);
        Path report = Paths.get(args.length == 2 ? args[1] : DEFAULT_REPORT);

        try {
            List<Customer> customers = new CustomerWorkbookReader().read(input);
            DeliveryPlanner planner = new DeliveryPlanner(SchedulerConfig.fromSystemProperties());
            DeliverySchedule schedule = planner.plan(customers);
            new ScheduleWorkbookWriter().write(schedule, report);
            log.info("Report ready: {} ({} day(s), {} km)", report, schedule.getDaysUsed(), schedule.totalDistanceKm());
            return EXIT_OK;
        } catch (SchedulingException ex) {
            log.error("Scheduling failed [{}]: {}", ex.reasonCode(), ex.getMessage());
            return EXIT_FAILURE;
        } catch (WorkbookFormatException ex) {
            log.error("Invalid customer workbook {}: {}", input, ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            log.error("I/O failure", ex);
            return EXIT_FAILURE;
        }
    }
}
