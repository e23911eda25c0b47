package org.eao.jsa.domain.error;

import java.util.List;

/**
 * Raised when a file header is missing a mandatory field or carries a value outside its domain.
 *
 * <p>Carries every problem found in the file so a single run reports them all.</p>
 *
 * @since 0.1.0
 */
public final class ValidationException extends IngestException {
  private static final long serialVersionUID = 1L;

  private final String fileId;
  private final List<String> problems;

  /**
   * Creates an exception for a single problem.
   *
   * @param fileId file whose header was rejected
   * @param problem description of the problem
   */
  public ValidationException(String fileId, String problem) {
    this(fileId, List.of(problem));
  }

  /**
   * Creates an exception listing all problems found in one file.
   *
   * @param fileId file whose header was rejected
   * @param problems problem descriptions; must not be empty
   */
  public ValidationException(String fileId, List<String> problems) {
    super(describe(fileId, problems));
    this.fileId = fileId;
    this.problems = List.copyOf(problems);
  }

  public String fileId() {
    return fileId;
  }

  public List<String> problems() {
    return problems;
  }

  private static String describe(String fileId, List<String> problems) {
    String label = fileId == null ? "<unknown file>" : fileId;
    if (problems.size() == 1) {
      return label + ": " + problems.get(0);
    }
    return label + ": " + problems.size() + " problems: " + String.join("; ", problems);
  }
}
