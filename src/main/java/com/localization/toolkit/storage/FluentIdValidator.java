package com.localization.toolkit.storage;

import com.localization.toolkit.storage.exception.InvalidIdException;
import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

/**
 * Id syntax checks for Fluent units.
 * Messages use {@code [a-zA-Z][a-zA-Z0-9_-]*}; terms the same with a leading dash.
 * Comment units have no id.
 */
@UtilityClass
public class FluentIdValidator {

    private static final String IDENTIFIER = "[a-zA-Z][a-zA-Z0-9_-]*";
    private static final Pattern MESSAGE_ID = Pattern.compile(IDENTIFIER);
    private static final Pattern TERM_ID = Pattern.compile("-" + IDENTIFIER);

    public static void validate(FluentType fluentType, String id) {
        switch (fluentType) {
            case MESSAGE:
                require(fluentType, id, MESSAGE_ID);
                break;
            case TERM:
                require(fluentType, id, TERM_ID);
                break;
            default:
                if (id != null) {
                    throw new InvalidIdException(fluentType, id, "comments cannot have an id");
                }
        }
    }

    public static boolean isValid(FluentType fluentType, String id) {
        try {
            validate(fluentType, id);
            return true;
        } catch (InvalidIdException e) {
            return false;
        }
    }

    private static void require(FluentType fluentType, String id, Pattern pattern) {
        if (id == null) {
            throw new InvalidIdException(fluentType, null, "an id is required");
        }
        if (!pattern.matcher(id).matches()) {
            throw new InvalidIdException(fluentType, id, "must match " + pattern.pattern());
        }
    }
}
