package com.hcltech.multiway;

import com.hcltech.multiway.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.List;

/** Parses comma separated integer lists such as {@code "3,1,1,2"}. Blank tokens are skipped. */
public final class ValueParser {
    private ValueParser() {}

    public static ErrorsOr<List<Integer>> parse(String csv) {
        if (csv == null) return ErrorsOr.error("No values given");
        List<ErrorsOr<Integer>> parsed = new ArrayList<>();
        for (String raw : csv.split(",", -1)) {
            String token = raw.trim();
            if (token.isEmpty()) continue;
            parsed.add(parseToken(token));
        }
        return ErrorsOr.all(parsed);
    }

    private static ErrorsOr<Integer> parseToken(String token) {
        try {
            return ErrorsOr.lift(Integer.parseInt(token));
        } catch (NumberFormatException e) {
            return ErrorsOr.error("Could not parse value '" + token + "' as an integer. Example: 3,1,1,2");
        }
    }
}
