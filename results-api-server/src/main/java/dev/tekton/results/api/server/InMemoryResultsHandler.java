// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.api.server;

import com.google.protobuf.Empty;
import com.google.protobuf.Timestamp;
import dev.tekton.results.api.server.ResultsNames.RecordName;
import dev.tekton.results.api.server.ResultsNames.ResultName;
import dev.tekton.results.api.v1alpha2.CreateRecordRequest;
import dev.tekton.results.api.v1alpha2.CreateResultRequest;
import dev.tekton.results.api.v1alpha2.DeleteRecordRequest;
import dev.tekton.results.api.v1alpha2.DeleteResultRequest;
import dev.tekton.results.api.v1alpha2.GetRecordRequest;
import dev.tekton.results.api.v1alpha2.GetResultRequest;
import dev.tekton.results.api.v1alpha2.ListRecordsRequest;
import dev.tekton.results.api.v1alpha2.ListRecordsResponse;
import dev.tekton.results.api.v1alpha2.ListResultsRequest;
import dev.tekton.results.api.v1alpha2.ListResultsResponse;
import dev.tekton.results.api.v1alpha2.Record;
import dev.tekton.results.api.v1alpha2.Result;
import dev.tekton.results.api.v1alpha2.UpdateRecordRequest;
import dev.tekton.results.api.v1alpha2.UpdateResultRequest;
import dev.tekton.results.authorizer.errors.InvalidResourceNameException;
import io.grpc.Status;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import org.apache.kafka.common.utils.Time;

/**
 * Results handler keeping results and records in memory. Contents are lost on restart.
 */
public class InMemoryResultsHandler implements ResultsHandler {

  static final int DEFAULT_PAGE_SIZE = 50;
  static final int MAX_PAGE_SIZE = 10000;

  private final Time time;
  private final NavigableMap<String, Result> results = new TreeMap<>();
  private final NavigableMap<String, Record> records = new TreeMap<>();
  private long generation;

  public InMemoryResultsHandler(Time time) {
    this.time = time;
  }

  @Override
  public synchronized Result createResult(CreateResultRequest request) {
    String namespace = parse(() -> ResultsNames.namespace(request.getParent()));
    if (!request.hasResult())
      throw Status.INVALID_ARGUMENT.withDescription("result is required").asRuntimeException();
    Result result = request.getResult();
    ResultName name = parse(() -> ResultsNames.result(result.getName()));
    if (!name.namespace().equals(namespace))
      throw Status.INVALID_ARGUMENT.withDescription("result " + name + " is not a child of " + namespace)
          .asRuntimeException();
    if (results.containsKey(name.toString()))
      throw Status.ALREADY_EXISTS.withDescription("result " + name + " already exists").asRuntimeException();

    String id = UUID.randomUUID().toString();
    Timestamp now = now();
    Result created = Result.newBuilder()
        .setName(name.toString())
        .setId(id)
        .setCreatedTime(now)
        .setUpdatedTime(now)
        .putAllAnnotations(result.getAnnotationsMap())
        .setEtag(etag(id))
        .build();
    results.put(created.getName(), created);
    return created;
  }

  @Override
  public synchronized Result getResult(GetResultRequest request) {
    return existingResult(parse(() -> ResultsNames.result(request.getName())));
  }

  @Override
  public synchronized Result updateResult(UpdateResultRequest request) {
    ResultName name = parse(() -> ResultsNames.result(request.getName()));
    Result existing = existingResult(name);
    checkEtag(request.getEtag(), existing.getEtag(), name.toString());
    Result.Builder updated = existing.toBuilder()
        .setUpdatedTime(now())
        .setEtag(etag(existing.getId()));
    if (request.hasResult()) {
      Result update = request.getResult();
      if (!update.getName().isEmpty() && !update.getName().equals(existing.getName()))
        throw Status.INVALID_ARGUMENT.withDescription("result name cannot be changed").asRuntimeException();
      updated.clearAnnotations().putAllAnnotations(update.getAnnotationsMap());
    }
    Result result = updated.build();
    results.put(result.getName(), result);
    return result;
  }

  @Override
  public synchronized Empty deleteResult(DeleteResultRequest request) {
    ResultName name = parse(() -> ResultsNames.result(request.getName()));
    existingResult(name);
    results.remove(name.toString());
    records.subMap(name + "/records/", true, name + "/records/\uffff", true).clear();
    return Empty.getDefaultInstance();
  }

  @Override
  public synchronized ListResultsResponse listResults(ListResultsRequest request) {
    String namespace = parse(() -> ResultsNames.namespace(request.getParent()));
    checkFilter(request.getFilter());
    List<Result> page = new ArrayList<>();
    String next = page(results, namespace + "/results/", request.getPageToken(), request.getPageSize(),
        page);
    return ListResultsResponse.newBuilder()
        .addAllResults(page)
        .setNextPageToken(next)
        .build();
  }

  @Override
  public synchronized Record createRecord(CreateRecordRequest request) {
    ResultName parent = parse(() -> ResultsNames.result(request.getParent()));
    existingResult(parent);
    if (!request.hasRecord())
      throw Status.INVALID_ARGUMENT.withDescription("record is required").asRuntimeException();
    Record record = request.getRecord();
    RecordName name = parse(() -> ResultsNames.record(record.getName()));
    if (!name.parent().toString().equals(parent.toString()))
      throw Status.INVALID_ARGUMENT.withDescription("record " + name + " is not a child of " + parent)
          .asRuntimeException();
    if (records.containsKey(name.toString()))
      throw Status.ALREADY_EXISTS.withDescription("record " + name + " already exists").asRuntimeException();

    String id = UUID.randomUUID().toString();
    Timestamp now = now();
    Record.Builder created = Record.newBuilder()
        .setName(name.toString())
        .setId(id)
        .setCreatedTime(now)
        .setUpdatedTime(now)
        .setEtag(etag(id));
    if (record.hasData())
      created.setData(record.getData());
    Record result = created.build();
    records.put(result.getName(), result);
    return result;
  }

  @Override
  public synchronized Record getRecord(GetRecordRequest request) {
    return existingRecord(parse(() -> ResultsNames.record(request.getName())));
  }

  @Override
  public synchronized Record updateRecord(UpdateRecordRequest request) {
    RecordName name = parse(() -> ResultsNames.record(request.getName()));
    Record existing = existingRecord(name);
    checkEtag(request.getEtag(), existing.getEtag(), name.toString());
    if (!request.hasRecord())
      throw Status.INVALID_ARGUMENT.withDescription("record is required").asRuntimeException();
    Record update = request.getRecord();
    if (!update.getName().isEmpty() && !update.getName().equals(existing.getName()))
      throw Status.INVALID_ARGUMENT.withDescription("record name cannot be changed").asRuntimeException();

    Record.Builder updated = existing.toBuilder()
        .clearData()
        .setUpdatedTime(now())
        .setEtag(etag(existing.getId()));
    if (update.hasData())
      updated.setData(update.getData());
    Record record = updated.build();
    records.put(record.getName(), record);
    return record;
  }

  @Override
  public synchronized Empty deleteRecord(DeleteRecordRequest request) {
    RecordName name = parse(() -> ResultsNames.record(request.getName()));
    existingRecord(name);
    records.remove(name.toString());
    return Empty.getDefaultInstance();
  }

  @Override
  public synchronized ListRecordsResponse listRecords(ListRecordsRequest request) {
    ResultName parent = parse(() -> ResultsNames.recordParent(request.getParent()));
    checkFilter(request.getFilter());
    List<Record> page = new ArrayList<>();
    String next;
    if (parent.isWildcard()) {
      next = page(records, parent.namespace() + "/results/", request.getPageToken(), request.getPageSize(),
          page);
    } else {
      existingResult(parent);
      next = page(records, parent + "/records/", request.getPageToken(), request.getPageSize(),
          page);
    }
    return ListRecordsResponse.newBuilder()
        .addAllRecords(page)
        .setNextPageToken(next)
        .build();
  }

  /**
   * Collects one page of the entries whose name starts with `prefix`, in name order.
   * The page token is the name of the last entry of the previous page.
   *
   * @return the token of the next page, or an empty string if this is the last page
   */
  private static <T> String page(NavigableMap<String, T> entries, String prefix, String pageToken,
                                 int pageSize, List<T> page) {
    if (pageSize < 0)
      throw Status.INVALID_ARGUMENT.withDescription("page size must not be negative").asRuntimeException();
    int limit = pageSize == 0 ? DEFAULT_PAGE_SIZE : Math.min(pageSize, MAX_PAGE_SIZE);
    boolean hasToken = !pageToken.isEmpty();
    if (hasToken && !pageToken.startsWith(prefix))
      throw Status.INVALID_ARGUMENT.withDescription("invalid page token").asRuntimeException();

    NavigableMap<String, T> candidates = hasToken
        ? entries.subMap(pageToken, false, prefix + "\uffff", true)
        : entries.subMap(prefix, true, prefix + "\uffff", true);
    String last = null;
    for (Map.Entry<String, T> entry : candidates.entrySet()) {
      if (page.size() == limit)
        return last;
      page.add(entry.getValue());
      last = entry.getKey();
    }
    return "";
  }

  private Result existingResult(ResultName name) {
    Result result = results.get(name.toString());
    if (result == null)
      throw Status.NOT_FOUND.withDescription("result " + name + " not found").asRuntimeException();
    return result;
  }

  private Record existingRecord(RecordName name) {
    Record record = records.get(name.toString());
    if (record == null)
      throw Status.NOT_FOUND.withDescription("record " + name + " not found").asRuntimeException();
    return record;
  }

  private static void checkEtag(String expected, String actual, String name) {
    if (!expected.isEmpty() && !expected.equals(actual))
      throw Status.FAILED_PRECONDITION.withDescription("etag mismatch for " + name).asRuntimeException();
  }

  private static void checkFilter(String filter) {
    if (!filter.isEmpty())
      throw Status.UNIMPLEMENTED.withDescription("filters are not supported").asRuntimeException();
  }

  private static <T> T parse(Supplier<T> parser) {
    try {
      return parser.get();
    } catch (InvalidResourceNameException e) {
      throw Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException();
    }
  }

  private Timestamp now() {
    long nowMs = time.milliseconds();
    return Timestamp.newBuilder()
        .setSeconds(nowMs / 1000)
        .setNanos((int) (nowMs % 1000) * 1_000_000)
        .build();
  }

  private String etag(String id) {
    return id + "-" + (++generation);
  }
}
