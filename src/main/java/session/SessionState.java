package session;

public enum SessionState {
    /** No image loaded. */
    EMPTY,
    /** The current buffer is the history entry at the history index. */
    COMMITTED,
    /** The current buffer is an unrecorded preview derived from that entry. */
    PREVIEWING
}
