package se.alipsa.dbext.local;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import se.alipsa.dbext.udx.SessionStore;

/**
 * In-process {@link SessionStore}. Blobs are copied on the way in and out so every worker reads its
 * own copy, as it would after the host shipped the session to it.
 */
public final class LocalSessionStore implements SessionStore {

  private final Map<String, byte[]> slots = new ConcurrentHashMap<>();

  @Override
  public void put(String slot, byte[] blob) {
    slots.put(slot, blob.clone());
  }

  @Override
  public byte[] get(String slot) {
    byte[] blob = slots.get(slot);
    return blob == null ? null : blob.clone();
  }
}
