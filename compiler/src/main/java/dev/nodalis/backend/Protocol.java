package dev.nodalis.backend;

/**
 * Industrial protocols a generated runtime can bind variables to.
 */
public enum Protocol {
    MODBUS,
    OPC_UA,
    BACNET
}
