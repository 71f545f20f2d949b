package com.strata.tabular;

/**
 * Reads one tabular format from raw bytes.
 */
interface TableReader {

    ParsedTable read(byte[] content);
}
