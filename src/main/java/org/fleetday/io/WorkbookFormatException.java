package org.fleetday.io;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a customer workbook does not follow the expected layout.
 *
 * <p>{@code rowNumber} is 1-based as shown by spreadsheet applications, or {@code 0}
 * when the failure is not tied to a data row.</p>
 */
@Getter
@Accessors(fluent = true)
public final class WorkbookFormatException extends RuntimeException {
    private final int rowNumber;

    public WorkbookFormatException(int rowNumber, String message) {
        super(rowNumber > 0 ? "row " + rowNumber + ": " + message : message);
        this.rowNumber = rowNumber;
    }
}
