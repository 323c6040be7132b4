package io.snapcheck.model;

/**
 * Lifecycle notification emitted by the test runner.
 */
public record RunnerEvent(Type type, String id) {
    public enum Type {
        TEST_STARTED,
        GROUP_FINISHED,
        SUITE_FINISHED
    }

    public static RunnerEvent testStarted(String testId) {
        return new RunnerEvent(Type.TEST_STARTED, testId);
    }

    public static RunnerEvent groupFinished(String groupId) {
        return new RunnerEvent(Type.GROUP_FINISHED, groupId);
    }

    public static RunnerEvent suiteFinished() {
        return new RunnerEvent(Type.SUITE_FINISHED, null);
    }
}
