package org.eao.jsa.application.port;

/**
 * Options of one exclusive hold on a stored observation.
 *
 * @param dryRun discard all changes instead of writing them
 * @param allowRemove permit deleting the observation when its last plane is removed
 * @since 0.1.0
 */
public record ProcessOptions(boolean dryRun, boolean allowRemove) {
  public static final ProcessOptions WRITE = new ProcessOptions(false, false);

  public ProcessOptions withAllowRemove(boolean allow) {
    return new ProcessOptions(dryRun, allow);
  }
}
