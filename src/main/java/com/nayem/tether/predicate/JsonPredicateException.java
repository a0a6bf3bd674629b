package com.nayem.tether.predicate;

/**
 * Thrown by {@link JsonPredicateParser} when a predicate document is malformed.
 * Evaluation never throws it; see {@link PredicateEngine#evaluate}.
 */
public class JsonPredicateException extends RuntimeException {

    public JsonPredicateException(String message) {
        super(message);
    }

    public JsonPredicateException(String message, Throwable cause) {
        super(message, cause);
    }
}
