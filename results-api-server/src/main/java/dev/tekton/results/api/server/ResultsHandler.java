// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.api.server;

import com.google.protobuf.Empty;
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

/**
 * Business handlers of the Results service. Handlers are only invoked for calls that
 * were allowed by the authorization gate. Failures are reported by throwing
 * {@link io.grpc.StatusRuntimeException}.
 */
public interface ResultsHandler {

  Result createResult(CreateResultRequest request);

  Result getResult(GetResultRequest request);

  Result updateResult(UpdateResultRequest request);

  Empty deleteResult(DeleteResultRequest request);

  ListResultsResponse listResults(ListResultsRequest request);

  Record createRecord(CreateRecordRequest request);

  Record getRecord(GetRecordRequest request);

  Record updateRecord(UpdateRecordRequest request);

  Empty deleteRecord(DeleteRecordRequest request);

  ListRecordsResponse listRecords(ListRecordsRequest request);
}
