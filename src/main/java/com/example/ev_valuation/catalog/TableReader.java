package com.example.ev_valuation.catalog;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a raw tabular input (header row first) into a {@link RawTable}.
 */
public interface TableReader {

    RawTable read(InputStream in) throws IOException;
}
