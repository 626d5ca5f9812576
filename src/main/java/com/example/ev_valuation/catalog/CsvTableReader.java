package com.example.ev_valuation.catalog;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class CsvTableReader implements TableReader {

    @Override
    public RawTable read(InputStream in) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(in, StandardCharsets.UTF_8))) {

            String headerLine = reader.readLine();
            if (headerLine == null) {
                return new RawTable(List.of(), List.of());
            }

            // BOM除去
            if (headerLine.startsWith("\uFEFF")) {
                headerLine = headerLine.substring(1);
            }

            List<String> header = parseCsvLine(headerLine);
            List<List<String>> rows = new ArrayList<>();

            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                rows.add(parseCsvLine(line));
            }
            return new RawTable(header, rows);
        }
    }

    /**
     * CSV行パース（引用符、エスケープ対応）
     * ダブルクォート内の "" はエスケープとして扱う
     */
    static List<String> parseCsvLine(String line) {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        char[] chars = line.toCharArray();

        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];

            if (inQuotes) {
                if (c == '"') {
                    // 次も " ならエスケープ
                    if (i + 1 < chars.length && chars[i + 1] == '"') {
                        current.append('"');
                        i++; // 次の " をスキップ
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == ',') {
                values.add(current.toString());
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }
        values.add(current.toString());
        return values;
    }
}
