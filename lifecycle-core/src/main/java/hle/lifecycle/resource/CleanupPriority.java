package hle.lifecycle.resource;

/**
 * Priority of a cleanup request. Declaration order is significance order,
 * so {@code LOW < NORMAL < HIGH < CRITICAL} under {@link Enum#compareTo}.
 */
public enum CleanupPriority {
    /** Background maintenance */
    LOW,
    /** Default priority, used for implicit releases */
    NORMAL,
    /** Important resources */
    HIGH,
    /** Must be cleaned up before anything else */
    CRITICAL;

    public static CleanupPriority defaultPriority() {
        return NORMAL;
    }
}
