// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.api.server;

import dev.tekton.results.api.server.ResultsNames.RecordName;
import dev.tekton.results.api.server.ResultsNames.ResultName;
import dev.tekton.results.api.v1alpha2.CreateRecordRequest;
import dev.tekton.results.api.v1alpha2.CreateResultRequest;
import dev.tekton.results.api.v1alpha2.DeleteRecordRequest;
import dev.tekton.results.api.v1alpha2.DeleteResultRequest;
import dev.tekton.results.api.v1alpha2.GetRecordRequest;
import dev.tekton.results.api.v1alpha2.GetResultRequest;
import dev.tekton.results.api.v1alpha2.ListRecordsRequest;
import dev.tekton.results.api.v1alpha2.ListResultsRequest;
import dev.tekton.results.api.v1alpha2.ResultsGrpc;
import dev.tekton.results.api.v1alpha2.UpdateRecordRequest;
import dev.tekton.results.api.v1alpha2.UpdateResultRequest;
import dev.tekton.results.authorizer.ResourceType;
import dev.tekton.results.authorizer.Verb;
import dev.tekton.results.authorizer.mapping.ResourceLocation;
import dev.tekton.results.authorizer.mapping.ResourceMapper;

/**
 * Authorization rules of the Results service. Results and records are authorized against
 * the `results` and `records` resources of the `results.tekton.dev` API group in the
 * namespace that owns them.
 */
public final class ResultsAuthorizationMappings {

  private ResultsAuthorizationMappings() {
  }

  public static ResourceMapper create() {
    return new ResourceMapper()
        .register(ResultsGrpc.getCreateResultMethod().getFullMethodName(), CreateResultRequest.class,
            ResourceType.RESULTS, Verb.CREATE,
            request -> ResourceLocation.namespace(ResultsNames.namespace(request.getParent())))
        .register(ResultsGrpc.getGetResultMethod().getFullMethodName(), GetResultRequest.class,
            ResourceType.RESULTS, Verb.GET,
            request -> result(request.getName()))
        .register(ResultsGrpc.getUpdateResultMethod().getFullMethodName(), UpdateResultRequest.class,
            ResourceType.RESULTS, Verb.UPDATE,
            request -> result(request.getName()))
        .register(ResultsGrpc.getDeleteResultMethod().getFullMethodName(), DeleteResultRequest.class,
            ResourceType.RESULTS, Verb.DELETE,
            request -> result(request.getName()))
        .register(ResultsGrpc.getListResultsMethod().getFullMethodName(), ListResultsRequest.class,
            ResourceType.RESULTS, Verb.LIST,
            request -> ResourceLocation.namespace(ResultsNames.namespace(request.getParent())))
        .register(ResultsGrpc.getCreateRecordMethod().getFullMethodName(), CreateRecordRequest.class,
            ResourceType.RECORDS, Verb.CREATE,
            request -> ResourceLocation.namespace(ResultsNames.result(request.getParent()).namespace()))
        .register(ResultsGrpc.getGetRecordMethod().getFullMethodName(), GetRecordRequest.class,
            ResourceType.RECORDS, Verb.GET,
            request -> record(request.getName()))
        .register(ResultsGrpc.getUpdateRecordMethod().getFullMethodName(), UpdateRecordRequest.class,
            ResourceType.RECORDS, Verb.UPDATE,
            request -> record(request.getName()))
        .register(ResultsGrpc.getDeleteRecordMethod().getFullMethodName(), DeleteRecordRequest.class,
            ResourceType.RECORDS, Verb.DELETE,
            request -> record(request.getName()))
        .register(ResultsGrpc.getListRecordsMethod().getFullMethodName(), ListRecordsRequest.class,
            ResourceType.RECORDS, Verb.LIST,
            request -> ResourceLocation.namespace(ResultsNames.recordParent(request.getParent()).namespace()));
  }

  private static ResourceLocation result(String name) {
    ResultName result = ResultsNames.result(name);
    return ResourceLocation.named(result.namespace(), result.result());
  }

  private static ResourceLocation record(String name) {
    RecordName record = ResultsNames.record(name);
    return ResourceLocation.named(record.namespace(), record.record());
  }
}
