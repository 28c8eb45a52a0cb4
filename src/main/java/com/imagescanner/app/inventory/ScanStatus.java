package com.imagescanner.app.inventory;

public enum ScanStatus {
    COMPLETED(0, "DONE"),
    FAILED(1, "FAILED"),
    CANCELLED(130, "CANCELED");

    private final int exitCode;
    private final String logStatus;

    ScanStatus(int exitCode, String logStatus) {
        this.exitCode = exitCode;
        this.logStatus = logStatus;
    }

    public int exitCode() {
        return exitCode;
    }

    /** Valor gravado na coluna scans.status. */
    public String logStatus() {
        return logStatus;
    }
}
