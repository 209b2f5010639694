package com.kakomon.extract;

/**
 * What the source says about the next request.
 */
public final class Continuation {
    public enum Kind {
        NEXT_PAGE,
        DONE,
        REQUEST_AGAIN
    }

    private static final Continuation DONE = new Continuation(Kind.DONE, "");
    private static final Continuation AGAIN = new Continuation(Kind.REQUEST_AGAIN, "");

    public final Kind kind;
    public final String token;

    private Continuation(Kind kind, String token) {
        this.kind = kind;
        this.token = token == null ? "" : token;
    }

    public static Continuation nextPage(String token) {
        if (token == null || token.isBlank()) {
            return DONE;
        }
        return new Continuation(Kind.NEXT_PAGE, token.trim());
    }

    public static Continuation done() {
        return DONE;
    }

    public static Continuation requestAgain() {
        return AGAIN;
    }

    @Override
    public String toString() {
        return kind == Kind.NEXT_PAGE ? "NEXT_PAGE(" + token + ")" : kind.name();
    }
}
