package com.convkit.client;

import com.convkit.codec.RecordSchema;
import com.convkit.http.HttpMethod;
import com.convkit.http.HttpTransport;
import com.convkit.http.JdkHttpTransport;
import com.convkit.http.Outcome;
import com.convkit.http.PathTemplate;
import com.convkit.http.RawResponse;
import com.convkit.http.RequestBuilder;
import com.convkit.http.RequestDescriptor;
import com.convkit.http.ResponseDispatcher;
import com.convkit.model.Context;
import com.convkit.model.Counterexample;
import com.convkit.model.CounterexampleCollection;
import com.convkit.model.CreateCounterexample;
import com.convkit.model.CreateDialogNode;
import com.convkit.model.CreateEntity;
import com.convkit.model.CreateExample;
import com.convkit.model.CreateIntent;
import com.convkit.model.CreateSynonym;
import com.convkit.model.CreateValue;
import com.convkit.model.CreateWorkspace;
import com.convkit.model.DialogNode;
import com.convkit.model.DialogNodeCollection;
import com.convkit.model.Entity;
import com.convkit.model.EntityCollection;
import com.convkit.model.EntityExport;
import com.convkit.model.Example;
import com.convkit.model.ExampleCollection;
import com.convkit.model.Intent;
import com.convkit.model.IntentCollection;
import com.convkit.model.IntentExport;
import com.convkit.model.LogCollection;
import com.convkit.model.MessageRequest;
import com.convkit.model.MessageResponse;
import com.convkit.model.Synonym;
import com.convkit.model.SynonymCollection;
import com.convkit.model.UpdateCounterexample;
import com.convkit.model.UpdateDialogNode;
import com.convkit.model.UpdateEntity;
import com.convkit.model.UpdateExample;
import com.convkit.model.UpdateIntent;
import com.convkit.model.UpdateSynonym;
import com.convkit.model.UpdateValue;
import com.convkit.model.UpdateWorkspace;
import com.convkit.model.Value;
import com.convkit.model.ValueCollection;
import com.convkit.model.ValueExport;
import com.convkit.model.Workspace;
import com.convkit.model.WorkspaceCollection;
import com.convkit.model.WorkspaceExport;
import com.convkit.observability.ClientMetrics;
import com.convkit.shared.config.ClientConfig;
import com.convkit.shared.error.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Client for the workspace and message endpoints. Every call is one request and one
 * eventual outcome: the returned future completes with the decoded record, or exceptionally
 * with a {@link com.convkit.shared.error.ConversationException}. Instances hold only
 * immutable configuration and are safe to share between threads.
 *
 * <p>Create and update both use {@code POST}, as the service does.
 */
public class ConversationClient {

    private static final Logger log = LoggerFactory.getLogger(ConversationClient.class);

    private static final PathTemplate WORKSPACES = PathTemplate.of("/v1/workspaces");
    private static final PathTemplate WORKSPACE = PathTemplate.of("/v1/workspaces/{workspace_id}");
    private static final PathTemplate MESSAGE = PathTemplate.of("/v1/workspaces/{workspace_id}/message");
    private static final PathTemplate INTENTS = PathTemplate.of("/v1/workspaces/{workspace_id}/intents");
    private static final PathTemplate INTENT = PathTemplate.of("/v1/workspaces/{workspace_id}/intents/{intent}");
    private static final PathTemplate EXAMPLES =
            PathTemplate.of("/v1/workspaces/{workspace_id}/intents/{intent}/examples");
    private static final PathTemplate EXAMPLE =
            PathTemplate.of("/v1/workspaces/{workspace_id}/intents/{intent}/examples/{text}");
    private static final PathTemplate COUNTEREXAMPLES =
            PathTemplate.of("/v1/workspaces/{workspace_id}/counterexamples");
    private static final PathTemplate COUNTEREXAMPLE =
            PathTemplate.of("/v1/workspaces/{workspace_id}/counterexamples/{text}");
    private static final PathTemplate ENTITIES = PathTemplate.of("/v1/workspaces/{workspace_id}/entities");
    private static final PathTemplate ENTITY = PathTemplate.of("/v1/workspaces/{workspace_id}/entities/{entity}");
    private static final PathTemplate VALUES =
            PathTemplate.of("/v1/workspaces/{workspace_id}/entities/{entity}/values");
    private static final PathTemplate VALUE =
            PathTemplate.of("/v1/workspaces/{workspace_id}/entities/{entity}/values/{value}");
    private static final PathTemplate SYNONYMS =
            PathTemplate.of("/v1/workspaces/{workspace_id}/entities/{entity}/values/{value}/synonyms");
    private static final PathTemplate SYNONYM =
            PathTemplate.of("/v1/workspaces/{workspace_id}/entities/{entity}/values/{value}/synonyms/{synonym}");
    private static final PathTemplate DIALOG_NODES = PathTemplate.of("/v1/workspaces/{workspace_id}/dialog_nodes");
    private static final PathTemplate DIALOG_NODE =
            PathTemplate.of("/v1/workspaces/{workspace_id}/dialog_nodes/{dialog_node}");
    private static final PathTemplate LOGS = PathTemplate.of("/v1/workspaces/{workspace_id}/logs");

    private final ClientConfig config;
    private final HttpTransport transport;
    private final ResponseDispatcher dispatcher;
    private final ClientMetrics metrics;

    public ConversationClient(ClientConfig config, HttpTransport transport) {
        this(config, transport, new ResponseDispatcher(), new ClientMetrics());
    }

    public ConversationClient(ClientConfig config, HttpTransport transport,
                              ResponseDispatcher dispatcher, ClientMetrics metrics) {
        this.config = config;
        this.transport = transport;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    /** A client over {@link JdkHttpTransport} using the configured credentials and timeouts. */
    public static ConversationClient create(ClientConfig config) {
        var transport = new JdkHttpTransport(
                config.credentials(),
                Duration.ofSeconds(config.connectTimeoutSeconds()),
                Duration.ofSeconds(config.requestTimeoutSeconds()));
        return new ConversationClient(config, transport);
    }

    public ClientConfig config() { return config; }

    public ClientMetrics metrics() { return metrics; }

    // --- Workspaces ---

    public CompletableFuture<WorkspaceCollection> listWorkspaces(ListOptions options) {
        return execute("listWorkspaces", WorkspaceCollection.SCHEMA,
                () -> paged(request(HttpMethod.GET, WORKSPACES), options));
    }

    public CompletableFuture<Workspace> createWorkspace(CreateWorkspace properties) {
        return execute("createWorkspace", Workspace.SCHEMA,
                () -> request(HttpMethod.POST, WORKSPACES).body(properties, CreateWorkspace.SCHEMA));
    }

    /** @param export when true the response includes all intents, entities and dialog nodes */
    public CompletableFuture<WorkspaceExport> getWorkspace(String workspaceId, Boolean export) {
        return execute("getWorkspace", WorkspaceExport.SCHEMA,
                () -> request(HttpMethod.GET, WORKSPACE, workspaceId).query("export", export));
    }

    public CompletableFuture<Workspace> updateWorkspace(String workspaceId, UpdateWorkspace properties) {
        return execute("updateWorkspace", Workspace.SCHEMA,
                () -> request(HttpMethod.POST, WORKSPACE, workspaceId).body(properties, UpdateWorkspace.SCHEMA));
    }

    public CompletableFuture<Void> deleteWorkspace(String workspaceId) {
        return executeVoid("deleteWorkspace", () -> request(HttpMethod.DELETE, WORKSPACE, workspaceId));
    }

    // --- Message ---

    public CompletableFuture<MessageResponse> message(String workspaceId, MessageRequest request) {
        return execute("message", MessageResponse.SCHEMA,
                () -> request(HttpMethod.POST, MESSAGE, workspaceId).body(request, MessageRequest.SCHEMA));
    }

    /**
     * Sends user text. Pass the {@link Context} of the previous response to continue that
     * conversation, or {@code null} to start a new one.
     */
    public CompletableFuture<MessageResponse> message(String workspaceId, String text, Context context) {
        return message(workspaceId, MessageRequest.of(text, context));
    }

    // --- Intents ---

    public CompletableFuture<IntentCollection> listIntents(String workspaceId, Boolean export, ListOptions options) {
        return execute("listIntents", IntentCollection.SCHEMA,
                () -> paged(request(HttpMethod.GET, INTENTS, workspaceId).query("export", export), options));
    }

    public CompletableFuture<Intent> createIntent(String workspaceId, CreateIntent intent) {
        return execute("createIntent", Intent.SCHEMA,
                () -> request(HttpMethod.POST, INTENTS, workspaceId).body(intent, CreateIntent.SCHEMA));
    }

    public CompletableFuture<IntentExport> getIntent(String workspaceId, String intent, Boolean export) {
        return execute("getIntent", IntentExport.SCHEMA,
                () -> request(HttpMethod.GET, INTENT, workspaceId, intent).query("export", export));
    }

    public CompletableFuture<Intent> updateIntent(String workspaceId, String intent, UpdateIntent update) {
        return execute("updateIntent", Intent.SCHEMA,
                () -> request(HttpMethod.POST, INTENT, workspaceId, intent).body(update, UpdateIntent.SCHEMA));
    }

    public CompletableFuture<Void> deleteIntent(String workspaceId, String intent) {
        return executeVoid("deleteIntent", () -> request(HttpMethod.DELETE, INTENT, workspaceId, intent));
    }

    // --- Examples ---

    public CompletableFuture<ExampleCollection> listExamples(String workspaceId, String intent, ListOptions options) {
        return execute("listExamples", ExampleCollection.SCHEMA,
                () -> paged(request(HttpMethod.GET, EXAMPLES, workspaceId, intent), options));
    }

    public CompletableFuture<Example> createExample(String workspaceId, String intent, CreateExample example) {
        return execute("createExample", Example.SCHEMA,
                () -> request(HttpMethod.POST, EXAMPLES, workspaceId, intent).body(example, CreateExample.SCHEMA));
    }

    public CompletableFuture<Example> getExample(String workspaceId, String intent, String text) {
        return execute("getExample", Example.SCHEMA,
                () -> request(HttpMethod.GET, EXAMPLE, workspaceId, intent, text));
    }

    public CompletableFuture<Example> updateExample(String workspaceId, String intent, String text,
                                                    UpdateExample update) {
        return execute("updateExample", Example.SCHEMA,
                () -> request(HttpMethod.POST, EXAMPLE, workspaceId, intent, text)
                        .body(update, UpdateExample.SCHEMA));
    }

    public CompletableFuture<Void> deleteExample(String workspaceId, String intent, String text) {
        return executeVoid("deleteExample", () -> request(HttpMethod.DELETE, EXAMPLE, workspaceId, intent, text));
    }

    // --- Counterexamples ---

    public CompletableFuture<CounterexampleCollection> listCounterexamples(String workspaceId, ListOptions options) {
        return execute("listCounterexamples", CounterexampleCollection.SCHEMA,
                () -> paged(request(HttpMethod.GET, COUNTEREXAMPLES, workspaceId), options));
    }

    public CompletableFuture<Counterexample> createCounterexample(String workspaceId,
                                                                  CreateCounterexample counterexample) {
        return execute("createCounterexample", Counterexample.SCHEMA,
                () -> request(HttpMethod.POST, COUNTEREXAMPLES, workspaceId)
                        .body(counterexample, CreateCounterexample.SCHEMA));
    }

    public CompletableFuture<Counterexample> getCounterexample(String workspaceId, String text) {
        return execute("getCounterexample", Counterexample.SCHEMA,
                () -> request(HttpMethod.GET, COUNTEREXAMPLE, workspaceId, text));
    }

    public CompletableFuture<Counterexample> updateCounterexample(String workspaceId, String text,
                                                                  UpdateCounterexample update) {
        return execute("updateCounterexample", Counterexample.SCHEMA,
                () -> request(HttpMethod.POST, COUNTEREXAMPLE, workspaceId, text)
                        .body(update, UpdateCounterexample.SCHEMA));
    }

    public CompletableFuture<Void> deleteCounterexample(String workspaceId, String text) {
        return executeVoid("deleteCounterexample",
                () -> request(HttpMethod.DELETE, COUNTEREXAMPLE, workspaceId, text));
    }

    // --- Entities ---

    public CompletableFuture<EntityCollection> listEntities(String workspaceId, Boolean export, ListOptions options) {
        return execute("listEntities", EntityCollection.SCHEMA,
                () -> paged(request(HttpMethod.GET, ENTITIES, workspaceId).query("export", export), options));
    }

    public CompletableFuture<Entity> createEntity(String workspaceId, CreateEntity entity) {
        return execute("createEntity", Entity.SCHEMA,
                () -> request(HttpMethod.POST, ENTITIES, workspaceId).body(entity, CreateEntity.SCHEMA));
    }

    public CompletableFuture<EntityExport> getEntity(String workspaceId, String entity, Boolean export) {
        return execute("getEntity", EntityExport.SCHEMA,
                () -> request(HttpMethod.GET, ENTITY, workspaceId, entity).query("export", export));
    }

    public CompletableFuture<Entity> updateEntity(String workspaceId, String entity, UpdateEntity update) {
        return execute("updateEntity", Entity.SCHEMA,
                () -> request(HttpMethod.POST, ENTITY, workspaceId, entity).body(update, UpdateEntity.SCHEMA));
    }

    public CompletableFuture<Void> deleteEntity(String workspaceId, String entity) {
        return executeVoid("deleteEntity", () -> request(HttpMethod.DELETE, ENTITY, workspaceId, entity));
    }

    // --- Values ---

    public CompletableFuture<ValueCollection> listValues(String workspaceId, String entity, Boolean export,
                                                         ListOptions options) {
        return execute("listValues", ValueCollection.SCHEMA,
                () -> paged(request(HttpMethod.GET, VALUES, workspaceId, entity).query("export", export), options));
    }

    public CompletableFuture<Value> createValue(String workspaceId, String entity, CreateValue value) {
        return execute("createValue", Value.SCHEMA,
                () -> request(HttpMethod.POST, VALUES, workspaceId, entity).body(value, CreateValue.SCHEMA));
    }

    public CompletableFuture<ValueExport> getValue(String workspaceId, String entity, String value, Boolean export) {
        return execute("getValue", ValueExport.SCHEMA,
                () -> request(HttpMethod.GET, VALUE, workspaceId, entity, value).query("export", export));
    }

    public CompletableFuture<Value> updateValue(String workspaceId, String entity, String value, UpdateValue update) {
        return execute("updateValue", Value.SCHEMA,
                () -> request(HttpMethod.POST, VALUE, workspaceId, entity, value).body(update, UpdateValue.SCHEMA));
    }

    public CompletableFuture<Void> deleteValue(String workspaceId, String entity, String value) {
        return executeVoid("deleteValue", () -> request(HttpMethod.DELETE, VALUE, workspaceId, entity, value));
    }

    // --- Synonyms ---

    public CompletableFuture<SynonymCollection> listSynonyms(String workspaceId, String entity, String value,
                                                             ListOptions options) {
        return execute("listSynonyms", SynonymCollection.SCHEMA,
                () -> paged(request(HttpMethod.GET, SYNONYMS, workspaceId, entity, value), options));
    }

    public CompletableFuture<Synonym> createSynonym(String workspaceId, String entity, String value,
                                                    CreateSynonym synonym) {
        return execute("createSynonym", Synonym.SCHEMA,
                () -> request(HttpMethod.POST, SYNONYMS, workspaceId, entity, value)
                        .body(synonym, CreateSynonym.SCHEMA));
    }

    public CompletableFuture<Synonym> getSynonym(String workspaceId, String entity, String value, String synonym) {
        return execute("getSynonym", Synonym.SCHEMA,
                () -> request(HttpMethod.GET, SYNONYM, workspaceId, entity, value, synonym));
    }

    public CompletableFuture<Synonym> updateSynonym(String workspaceId, String entity, String value, String synonym,
                                                    UpdateSynonym update) {
        return execute("updateSynonym", Synonym.SCHEMA,
                () -> request(HttpMethod.POST, SYNONYM, workspaceId, entity, value, synonym)
                        .body(update, UpdateSynonym.SCHEMA));
    }

    public CompletableFuture<Void> deleteSynonym(String workspaceId, String entity, String value, String synonym) {
        return executeVoid("deleteSynonym",
                () -> request(HttpMethod.DELETE, SYNONYM, workspaceId, entity, value, synonym));
    }

    // --- Dialog nodes ---

    public CompletableFuture<DialogNodeCollection> listDialogNodes(String workspaceId, ListOptions options) {
        return execute("listDialogNodes", DialogNodeCollection.SCHEMA,
                () -> paged(request(HttpMethod.GET, DIALOG_NODES, workspaceId), options));
    }

    public CompletableFuture<DialogNode> createDialogNode(String workspaceId, CreateDialogNode node) {
        return execute("createDialogNode", DialogNode.SCHEMA,
                () -> request(HttpMethod.POST, DIALOG_NODES, workspaceId).body(node, CreateDialogNode.SCHEMA));
    }

    public CompletableFuture<DialogNode> getDialogNode(String workspaceId, String dialogNode) {
        return execute("getDialogNode", DialogNode.SCHEMA,
                () -> request(HttpMethod.GET, DIALOG_NODE, workspaceId, dialogNode));
    }

    public CompletableFuture<DialogNode> updateDialogNode(String workspaceId, String dialogNode,
                                                          UpdateDialogNode update) {
        return execute("updateDialogNode", DialogNode.SCHEMA,
                () -> request(HttpMethod.POST, DIALOG_NODE, workspaceId, dialogNode)
                        .body(update, UpdateDialogNode.SCHEMA));
    }

    public CompletableFuture<Void> deleteDialogNode(String workspaceId, String dialogNode) {
        return executeVoid("deleteDialogNode",
                () -> request(HttpMethod.DELETE, DIALOG_NODE, workspaceId, dialogNode));
    }

    // --- Logs ---

    public CompletableFuture<LogCollection> listLogs(String workspaceId, LogQuery query) {
        var q = query != null ? query : LogQuery.none();
        return execute("listLogs", LogCollection.SCHEMA,
                () -> q.applyTo(request(HttpMethod.GET, LOGS, workspaceId)));
    }

    // --- plumbing ---

    private RequestBuilder request(HttpMethod method, PathTemplate path, String... params) {
        return RequestBuilder.request(method, config.serviceUrl(), config.version(), path, params)
                .headers(config.defaultHeaders());
    }

    private static RequestBuilder paged(RequestBuilder request, ListOptions options) {
        return (options != null ? options : ListOptions.none()).applyTo(request);
    }

    private CompletableFuture<Void> executeVoid(String operation, Supplier<RequestBuilder> requestFactory) {
        return execute(operation, null, requestFactory);
    }

    /**
     * Builds the request, sends it and dispatches the response. A request that cannot be built
     * fails the returned future without reaching the transport.
     *
     * @param schema response record, or {@code null} when the operation returns nothing
     */
    private <T> CompletableFuture<T> execute(String operation, RecordSchema<T> schema,
                                             Supplier<RequestBuilder> requestFactory) {
        RequestDescriptor request;
        try {
            request = requestFactory.get().build();
        } catch (RuntimeException e) {
            log.warn("Cannot build {} request: {}", operation, e.getMessage());
            metrics.record(operation, Duration.ZERO, e);
            return CompletableFuture.failedFuture(e);
        }

        log.debug("{}: {}", operation, request);
        long start = System.nanoTime();
        return transport.send(request)
                .thenApply(response -> complete(operation, request, response, schema, start))
                .whenComplete((result, error) -> metrics.record(
                        operation, Duration.ofNanos(System.nanoTime() - start), unwrap(error)));
    }

    private <T> T complete(String operation, RequestDescriptor request, RawResponse response,
                           RecordSchema<T> schema, long start) {
        log.debug("{}: {} returned {} in {}ms", operation, request, response.statusCode(),
                (System.nanoTime() - start) / 1_000_000);
        Outcome<T> outcome = dispatcher.dispatch(response, schema);
        if (outcome instanceof Outcome.Failure<T> failure && failure.error() instanceof ServiceException se) {
            log.warn("{}: {} failed with {}", operation, request, se.getMessage());
        }
        if (schema == null && outcome.isSuccess()) return null;
        return outcome.get();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) return error.getCause();
        return error;
    }
}
