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
import dev.tekton.results.api.v1alpha2.ResultsGrpc;
import dev.tekton.results.api.v1alpha2.UpdateRecordRequest;
import dev.tekton.results.api.v1alpha2.UpdateResultRequest;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The `tekton.results.v1alpha2.Results` service, answering each call from a
 * {@link ResultsHandler}.
 */
public class ResultsService extends ResultsGrpc.ResultsImplBase {
  private static final Logger log = LoggerFactory.getLogger(ResultsService.class);

  private final ResultsHandler handler;

  public ResultsService(ResultsHandler handler) {
    this.handler = handler;
  }

  /**
   * Full names of all methods exposed by the service.
   */
  public static List<String> methodNames() {
    return ResultsGrpc.getServiceDescriptor().getMethods().stream()
        .map(MethodDescriptor::getFullMethodName)
        .sorted()
        .collect(Collectors.toList());
  }

  @Override
  public void createResult(CreateResultRequest request, StreamObserver<Result> responseObserver) {
    respond(handler::createResult, request, responseObserver);
  }

  @Override
  public void getResult(GetResultRequest request, StreamObserver<Result> responseObserver) {
    respond(handler::getResult, request, responseObserver);
  }

  @Override
  public void updateResult(UpdateResultRequest request, StreamObserver<Result> responseObserver) {
    respond(handler::updateResult, request, responseObserver);
  }

  @Override
  public void deleteResult(DeleteResultRequest request, StreamObserver<Empty> responseObserver) {
    respond(handler::deleteResult, request, responseObserver);
  }

  @Override
  public void listResults(ListResultsRequest request, StreamObserver<ListResultsResponse> responseObserver) {
    respond(handler::listResults, request, responseObserver);
  }

  @Override
  public void createRecord(CreateRecordRequest request, StreamObserver<Record> responseObserver) {
    respond(handler::createRecord, request, responseObserver);
  }

  @Override
  public void getRecord(GetRecordRequest request, StreamObserver<Record> responseObserver) {
    respond(handler::getRecord, request, responseObserver);
  }

  @Override
  public void updateRecord(UpdateRecordRequest request, StreamObserver<Record> responseObserver) {
    respond(handler::updateRecord, request, responseObserver);
  }

  @Override
  public void deleteRecord(DeleteRecordRequest request, StreamObserver<Empty> responseObserver) {
    respond(handler::deleteRecord, request, responseObserver);
  }

  @Override
  public void listRecords(ListRecordsRequest request, StreamObserver<ListRecordsResponse> responseObserver) {
    respond(handler::listRecords, request, responseObserver);
  }

  private static <ReqT, RespT> void respond(Function<ReqT, RespT> method, ReqT request,
                                            StreamObserver<RespT> responseObserver) {
    RespT response;
    try {
      response = method.apply(request);
    } catch (StatusRuntimeException e) {
      responseObserver.onError(e);
      return;
    } catch (RuntimeException e) {
      log.error("Unexpected error in results handler", e);
      responseObserver.onError(Status.INTERNAL.withDescription("internal error").asRuntimeException());
      return;
    }
    responseObserver.onNext(response);
    responseObserver.onCompleted();
  }
}
