package org.carball.queryopt.driver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A statement together with its bound arguments. Arguments may contain nulls.
 */
public record Statement(
        String sql,
        List<Object> args
) {

    public Statement {
        Objects.requireNonNull(sql, "sql");
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static Statement of(String sql, Object... args) {
        return new Statement(sql, Arrays.asList(args));
    }
}
