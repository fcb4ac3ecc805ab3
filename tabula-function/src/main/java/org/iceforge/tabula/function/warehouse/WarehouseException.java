package org.iceforge.tabula.function.warehouse;

public class WarehouseException extends RuntimeException {
    public WarehouseException(String message, Throwable cause) { super(message, cause); }
    public WarehouseException(String message) { super(message); }
}
