package atrium.core.model.privacy;

/**
 * Actions a caller can attempt against a profile.
 */
public enum AccessAction {
    VIEW,
    CONTACT,
    EDIT
}
