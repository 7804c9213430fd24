package se.alipsa.dbext.udx;

/**
 * Session-scoped storage for serialized state. The host distributes every slot to all workers
 * taking part in the session.
 */
public interface SessionStore {

  /**
   * Store a blob in a named slot, replacing any previous content.
   *
   * @param slot
   *          the slot name
   * @param blob
   *          the serialized state
   */
  void put(String slot, byte[] blob);

  /**
   * Read a slot.
   *
   * @param slot
   *          the slot name
   * @return the stored blob, or {@code null} when the slot is empty
   */
  byte[] get(String slot);
}
