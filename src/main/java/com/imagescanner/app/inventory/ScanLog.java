package com.imagescanner.app.inventory;

/**
 * Registro de runs (tabela {@code scans}). Falhas aqui nunca derrubam o scan.
 */
public interface ScanLog {

    /** @return id do run, usado em {@link ScanReport#scanId()} */
    long start(String rootPath);

    void finish(ScanReport report);
}
