package com.imagescanner.app.inventory;

/**
 * Estado terminal normal, não é erro: o trabalho em andamento foi abandonado a pedido do usuário.
 */
public class ScanCancelledException extends RuntimeException {

    public ScanCancelledException() {
        super("Scan cancelado");
    }
}
