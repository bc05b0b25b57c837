// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.api.server;

import dev.tekton.results.authorizer.errors.InvalidResourceNameException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Results resource names:
 * <ul>
 *   <li>parent of results: `{namespace}`</li>
 *   <li>result: `{namespace}/results/{result}`</li>
 *   <li>record: `{namespace}/results/{result}/records/{record}`</li>
 * </ul>
 * The result segment of a record parent may be {@value #ANY_RESULT} when listing.
 */
public final class ResultsNames {

  public static final String ANY_RESULT = "-";

  private static final String SEGMENT = "([^/\\s]+)";
  private static final Pattern NAMESPACE = Pattern.compile(SEGMENT);
  private static final Pattern RESULT = Pattern.compile(SEGMENT + "/results/" + SEGMENT);
  private static final Pattern RECORD = Pattern.compile(SEGMENT + "/results/" + SEGMENT + "/records/" + SEGMENT);

  private ResultsNames() {
  }

  /**
   * Validates the parent of a result and returns its namespace.
   */
  public static String namespace(String parent) {
    return match(NAMESPACE, parent, "namespace").group(1);
  }

  public static ResultName result(String name) {
    Matcher m = match(RESULT, name, "result name");
    if (ANY_RESULT.equals(m.group(2)))
      throw new InvalidResourceNameException("Result name " + name + " does not name a single result");
    return new ResultName(m.group(1), m.group(2));
  }

  /**
   * Parses the parent of records, which may name all results of a namespace.
   */
  public static ResultName recordParent(String parent) {
    Matcher m = match(RESULT, parent, "record parent");
    return new ResultName(m.group(1), m.group(2));
  }

  public static RecordName record(String name) {
    Matcher m = match(RECORD, name, "record name");
    if (ANY_RESULT.equals(m.group(2)))
      throw new InvalidResourceNameException("Record name " + name + " does not name a single result");
    return new RecordName(new ResultName(m.group(1), m.group(2)), m.group(3));
  }

  private static Matcher match(Pattern pattern, String name, String kind) {
    if (name == null || name.isEmpty())
      throw new InvalidResourceNameException("Missing " + kind);
    Matcher m = pattern.matcher(name);
    if (!m.matches())
      throw new InvalidResourceNameException("Invalid " + kind + " " + name);
    return m;
  }

  public static class ResultName {
    private final String namespace;
    private final String result;

    ResultName(String namespace, String result) {
      this.namespace = namespace;
      this.result = result;
    }

    public String namespace() {
      return namespace;
    }

    public String result() {
      return result;
    }

    public boolean isWildcard() {
      return ANY_RESULT.equals(result);
    }

    @Override
    public String toString() {
      return namespace + "/results/" + result;
    }
  }

  public static class RecordName {
    private final ResultName parent;
    private final String record;

    RecordName(ResultName parent, String record) {
      this.parent = parent;
      this.record = record;
    }

    public ResultName parent() {
      return parent;
    }

    public String namespace() {
      return parent.namespace();
    }

    public String record() {
      return record;
    }

    @Override
    public String toString() {
      return parent + "/records/" + record;
    }
  }
}
