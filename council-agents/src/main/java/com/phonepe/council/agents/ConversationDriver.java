/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.council.agents;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.phonepe.council.core.agent.DefaultToolRunner;
import com.phonepe.council.core.agent.Session;
import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.agentmessages.requests.UserPrompt;
import com.phonepe.council.core.errors.CouncilError;
import com.phonepe.council.core.errors.CouncilException;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.model.Model;
import com.phonepe.council.core.model.ModelOutput;
import com.phonepe.council.core.model.ModelRunContext;
import com.phonepe.council.core.model.ModelSettings;
import com.phonepe.council.core.model.ModelUsageStats;
import com.phonepe.council.core.tools.ToolRunApprovalSeeker;
import com.phonepe.council.core.utils.AgentUtils;
import com.phonepe.council.session.AgentStore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs one conversation turn: persists the user message, assembles history, instructions and tools, lets the model
 * run its tool loop while streaming text out, then persists everything the model produced along with the usage.
 * <p>
 * The user message stays in the transcript even if the turn fails later. Nothing else from a failed turn is stored.
 * Stream handler failures never stop the turn from being persisted.
 */
@Slf4j
public class ConversationDriver {

    /**
     * State carried from preparation to completion of a turn
     */
    @Value
    private static class Turn {
        String agentId;
        String sessionId;
        List<AgentMessage> history;
        ModelRunContext context;
        TurnTools tools;
        SafeStreamHandler streamHandler;
    }

    /**
     * Forwards chunks to the caller until the caller fails once. After that chunks are dropped.
     */
    private static final class SafeStreamHandler implements Consumer<String> {
        private final Consumer<String> delegate;
        private final String agentId;
        private final String sessionId;
        private final AtomicBoolean failed = new AtomicBoolean(false);

        private SafeStreamHandler(Consumer<String> delegate, String agentId, String sessionId) {
            this.delegate = delegate;
            this.agentId = agentId;
            this.sessionId = sessionId;
        }

        @Override
        public void accept(String chunk) {
            if (failed.get()) {
                return;
            }
            try {
                delegate.accept(chunk);
            }
            catch (RuntimeException e) {
                failed.set(true);
                log.warn("{} for agent {} session {}. Turn will continue without streaming.",
                         CouncilError.error(ErrorType.STREAMING_IO_FAILURE, e).getMessage(), agentId, sessionId);
            }
        }

        boolean delivered() {
            return !failed.get();
        }
    }

    private final AgentStore agentStore;
    private final ToolRegistry toolRegistry;
    private final Model model;
    private final ObjectMapper mapper;
    private final ModelSettings modelSettings;
    private final ToolRunApprovalSeeker toolRunApprovalSeeker;
    private final ExecutorService executorService;
    private final boolean serializeSessionTurns;
    private final Map<String, CompletableFuture<TurnOutput>> sessionTails = new ConcurrentHashMap<>();

    @Builder
    @SuppressWarnings("java:S107")
    public ConversationDriver(
            @NonNull AgentStore agentStore,
            @NonNull ToolRegistry toolRegistry,
            @NonNull Model model,
            @NonNull ObjectMapper mapper,
            ModelSettings modelSettings,
            ToolRunApprovalSeeker toolRunApprovalSeeker,
            @NonNull ExecutorService executorService,
            boolean serializeSessionTurns) {
        this.agentStore = agentStore;
        this.toolRegistry = toolRegistry;
        this.model = model;
        this.mapper = mapper;
        this.modelSettings = modelSettings;
        this.toolRunApprovalSeeker = null == toolRunApprovalSeeker
                                     ? ToolRunApprovalSeeker.approveAll()
                                     : toolRunApprovalSeeker;
        this.executorService = executorService;
        this.serializeSessionTurns = serializeSessionTurns;
    }

    public CompletableFuture<TurnOutput> converse(TurnRequest request) {
        return converse(request, chunk -> {});
    }

    /**
     * Runs a turn, sending generated text to the handler as it arrives.
     *
     * @param request       The user message
     * @param streamHandler Receives text chunks. Exceptions thrown by it are logged and further chunks are dropped.
     * @return Output of the turn. Completes exceptionally with a {@link CouncilException} on failure.
     */
    public CompletableFuture<TurnOutput> converse(TurnRequest request, Consumer<String> streamHandler) {
        final TurnRequest validated;
        try {
            validated = validate(request);
        }
        catch (CouncilException e) {
            return CompletableFuture.failedFuture(e);
        }
        final var handler = null == streamHandler ? (Consumer<String>) chunk -> {} : streamHandler;
        if (!serializeSessionTurns) {
            return runTurn(validated, handler);
        }
        final var key = validated.getAgentId() + "/" + validated.getSessionId();
        final var turn = sessionTails.compute(
                key,
                (k, tail) -> (null == tail
                              ? CompletableFuture.<TurnOutput>completedFuture(null)
                              : tail.handle((output, error) -> (TurnOutput) null))
                        .thenCompose(ignored -> runTurn(validated, handler)));
        turn.whenComplete((output, error) -> sessionTails.remove(key, turn));
        return turn;
    }

    private TurnRequest validate(TurnRequest request) {
        if (null == request || AgentUtils.isBlank(request.getAgentId())) {
            throw CouncilException.invalidInput("Agent id is required");
        }
        if (AgentUtils.isBlank(request.getContent())) {
            throw CouncilException.invalidInput("Message content is required");
        }
        final var agentId = request.getAgentId().trim();
        if (!agentStore.agentExists(agentId)) {
            throw CouncilException.notFound("Agent " + agentId);
        }
        return TurnRequest.builder()
                .agentId(agentId)
                .sessionId(AgentUtils.isBlank(request.getSessionId())
                           ? Session.DEFAULT_SESSION_ID
                           : request.getSessionId().trim())
                .content(request.getContent().trim())
                .build();
    }

    private CompletableFuture<TurnOutput> runTurn(TurnRequest request, Consumer<String> streamHandler) {
        return CompletableFuture.supplyAsync(() -> prepare(request, streamHandler), executorService)
                .thenCompose(turn -> {
                    final var stopwatch = Stopwatch.createStarted();
                    final CompletableFuture<ModelOutput> run;
                    try {
                        run = model.exchangeMessagesStreaming(turn.getContext(),
                                                              turn.getHistory(),
                                                              turn.getTools().getTools(),
                                                              new DefaultToolRunner(turn.getContext(),
                                                                                    mapper,
                                                                                    toolRunApprovalSeeker),
                                                              turn.getStreamHandler());
                    }
                    catch (RuntimeException e) {
                        turn.getTools().close();
                        return CompletableFuture.failedFuture(modelStartFailure(turn, e));
                    }
                    return run.thenApply(output -> complete(turn, output, stopwatch))
                            .whenComplete((output, error) -> turn.getTools().close());
                });
    }

    private static CouncilException modelStartFailure(Turn turn, RuntimeException e) {
        log.error("Could not start run {} for agent {} session {}: {}",
                  turn.getContext().getRunId(), turn.getAgentId(), turn.getSessionId(), e.getMessage(), e);
        if (e instanceof CouncilException councilException) {
            return councilException;
        }
        return new CouncilException(
                CouncilError.error(ErrorType.GENERIC_MODEL_CALL_FAILURE,
                                   Objects.requireNonNullElse(e.getMessage(), e.getClass().getSimpleName())),
                e);
    }

    private Turn prepare(TurnRequest request, Consumer<String> streamHandler) {
        final var agentId = request.getAgentId();
        final var sessionId = request.getSessionId();
        agentStore.appendMessage(agentId, sessionId, new UserPrompt(request.getContent()));
        final var history = agentStore.getMessages(agentId, sessionId);
        final var systemPrompt = agentStore.getSystemPrompt(agentId);
        final var runId = AgentUtils.newRunId();
        final var tools = toolRegistry.assemble(agentId);
        log.debug("Starting run {} for agent {} session {} with {} messages and {} tools",
                  runId, agentId, sessionId, history.size(), tools.getTools().size());
        return new Turn(agentId,
                        sessionId,
                        history,
                        ModelRunContext.builder()
                                .agentId(agentId)
                                .sessionId(sessionId)
                                .runId(runId)
                                .systemPrompt(systemPrompt)
                                .modelSettings(modelSettings)
                                .executorService(executorService)
                                .modelUsageStats(new ModelUsageStats())
                                .build(),
                        tools,
                        new SafeStreamHandler(streamHandler, agentId, sessionId));
    }

    private TurnOutput complete(Turn turn, ModelOutput output, Stopwatch stopwatch) {
        final var context = turn.getContext();
        if (!output.isSuccess()) {
            log.error("Run {} for agent {} session {} failed after {} ms: {}",
                      context.getRunId(),
                      turn.getAgentId(),
                      turn.getSessionId(),
                      stopwatch.elapsed(TimeUnit.MILLISECONDS),
                      output.getError().getMessage());
            throw new CouncilException(output.getError());
        }
        agentStore.appendMessages(turn.getAgentId(), turn.getSessionId(), output.getNewMessages());
        final var usage = context.getModelUsageStats().toSessionUsage();
        final var totals = agentStore.addUsage(turn.getAgentId(), turn.getSessionId(), usage);
        log.info("Run {} for agent {} session {} completed in {} ms. Messages: {} Tool calls: {} Tokens: {}",
                 context.getRunId(),
                 turn.getAgentId(),
                 turn.getSessionId(),
                 stopwatch.elapsed(TimeUnit.MILLISECONDS),
                 output.getNewMessages().size(),
                 context.getModelUsageStats().getToolCallsForRun(),
                 usage.getTotalTokens());
        return TurnOutput.builder()
                .agentId(turn.getAgentId())
                .sessionId(turn.getSessionId())
                .data(output.getData())
                .newMessages(output.getNewMessages())
                .usage(usage)
                .sessionUsage(totals)
                .streamDelivered(turn.getStreamHandler().delivered())
                .build();
    }
}
