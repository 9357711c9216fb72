package io.chatbox.core;

/**
 * Optional self-declared profile attached to a session.
 */
public record Profile(Integer age, String location, String sex) {

    public static final int MIN_AGE = 18;
    public static final int MAX_AGE = 120;

    public static Profile empty() {
        return new Profile(null, null, null);
    }

    public boolean isComplete() {
        return age != null && notBlank(location) && notBlank(sex);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
