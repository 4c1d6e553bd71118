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

package com.phonepe.council.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.primitives.Longs;
import com.google.common.util.concurrent.Striped;
import com.phonepe.council.core.agent.Agent;
import com.phonepe.council.core.agent.RemoteToolServerConfig;
import com.phonepe.council.core.agent.Session;
import com.phonepe.council.core.agent.SessionUsage;
import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.errors.CouncilError;
import com.phonepe.council.core.errors.CouncilException;
import com.phonepe.council.core.errors.ErrorType;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Persists agents, their sessions, session transcripts and usage counters on top of a {@link DataStore}.
 * <p>
 * All operations other than {@link #createAgent(String, String)} fail with
 * {@link ErrorType#NOT_FOUND} if the agent does not exist. Sessions are created on first reference.
 */
@Slf4j
public class AgentStore {
    static final String FIELD_ID = "id";
    static final String FIELD_NAME = "name";
    static final String FIELD_SYSTEM_PROMPT = "systemPrompt";
    static final String FIELD_SERVERS = "mcpServers";
    static final String FIELD_AGENT_ID = "agentId";
    static final String FIELD_CREATED_AT = "createdAt";
    static final String FIELD_UPDATED_AT = "updatedAt";
    static final String FIELD_LAST_MESSAGE_AT = "lastMessageAt";
    static final String FIELD_INPUT_TOKENS = "usageInputTokens";
    static final String FIELD_REASONING_TOKENS = "usageReasoningTokens";
    static final String FIELD_OUTPUT_TOKENS = "usageOutputTokens";
    static final String FIELD_TOTAL_TOKENS = "usageTotalTokens";

    private final DataStore dataStore;
    private final ObjectMapper mapper;
    private final BootstrapPromptLoader bootstrapPromptLoader;
    private final StoreKeys keys;
    private final Clock clock;

    /**
     * Serialize read-modify-write cycles within this process. A session lock is never held while taking an agent lock.
     */
    private final Striped<Lock> agentLocks = Striped.lock(64);
    private final Striped<Lock> sessionLocks = Striped.lock(64);

    @Builder
    public AgentStore(
            @NonNull DataStore dataStore,
            @NonNull ObjectMapper mapper,
            @NonNull BootstrapPromptLoader bootstrapPromptLoader,
            String namespace,
            Clock clock) {
        this.dataStore = dataStore;
        this.mapper = mapper;
        this.bootstrapPromptLoader = bootstrapPromptLoader;
        this.keys = new StoreKeys(Strings.isNullOrEmpty(namespace) ? StoreKeys.DEFAULT_NAMESPACE : namespace);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    public Agent createAgent(final String agentId, final String name) {
        final var id = requireText(agentId, "Agent id is required");
        final var displayName = requireText(name, "Agent name is required");
        return withAgentLock(id, () -> {
            if (dataStore.exists(keys.agent(id))) {
                throw CouncilException.conflict("Agent id already exists: " + id);
            }
            final var now = now();
            final var prompt = bootstrapPromptLoader.load();
            dataStore.setFields(keys.agent(id), Map.of(
                    FIELD_ID, id,
                    FIELD_NAME, displayName,
                    FIELD_SYSTEM_PROMPT, prompt,
                    FIELD_SERVERS, "[]",
                    FIELD_CREATED_AT, now.toString(),
                    FIELD_UPDATED_AT, now.toString()));
            dataStore.addToSet(keys.agents(), id);
            ensureSession(id, Session.DEFAULT_SESSION_ID, now);
            log.info("Created agent {} ({})", id, displayName);
            return Agent.builder()
                    .id(id)
                    .name(displayName)
                    .systemPrompt(prompt)
                    .toolServers(List.of())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        });
    }

    /**
     * All agents sorted by display name. Index entries without a complete record are skipped.
     */
    public List<Agent> listAgents() {
        return dataStore.setMembers(keys.agents())
                .stream()
                .map(id -> toAgent(dataStore.getFields(keys.agent(id))))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(Agent::getName).thenComparing(Agent::getId))
                .toList();
    }

    public Agent getAgent(final String agentId) {
        return toAgent(requireAgentFields(agentId))
                .orElseThrow(() -> CouncilException.notFound("Agent " + agentId));
    }

    public boolean agentExists(final String agentId) {
        return !Strings.isNullOrEmpty(agentId) && toAgent(dataStore.getFields(keys.agent(agentId))).isPresent();
    }

    public String getSystemPrompt(final String agentId) {
        final var prompt = requireAgentFields(agentId).get(FIELD_SYSTEM_PROMPT);
        return Strings.isNullOrEmpty(prompt) ? bootstrapPromptLoader.load() : prompt;
    }

    /**
     * Stores the trimmed prompt and returns it
     */
    public String updateSystemPrompt(final String agentId, final String systemPrompt) {
        final var prompt = requireText(systemPrompt, "System prompt is required");
        requireAgentFields(agentId);
        dataStore.setFields(keys.agent(agentId), Map.of(FIELD_SYSTEM_PROMPT, prompt,
                                                        FIELD_UPDATED_AT, now().toString()));
        log.info("Updated system prompt for agent {}", agentId);
        return prompt;
    }

    public String resetSystemPrompt(final String agentId) {
        requireAgentFields(agentId);
        final var prompt = bootstrapPromptLoader.load();
        dataStore.setFields(keys.agent(agentId), Map.of(FIELD_SYSTEM_PROMPT, prompt,
                                                        FIELD_UPDATED_AT, now().toString()));
        log.info("Reset system prompt for agent {}", agentId);
        return prompt;
    }

    /**
     * Sessions of the agent, default session first and the rest by id
     */
    public List<Session> listSessions(final String agentId) {
        requireAgentFields(agentId);
        var ids = dataStore.setMembers(keys.sessions(agentId));
        if (ids.isEmpty()) {
            ensureSession(agentId, Session.DEFAULT_SESSION_ID, now());
            ids = Set.of(Session.DEFAULT_SESSION_ID);
        }
        return ids.stream()
                .sorted(Comparator.comparing((String id) -> !Session.DEFAULT_SESSION_ID.equals(id))
                                .thenComparing(Comparator.naturalOrder()))
                .map(id -> toSession(agentId, id, dataStore.getFields(keys.session(agentId, id))))
                .toList();
    }

    public void appendMessage(final String agentId, final String sessionId, final AgentMessage message) {
        appendMessages(agentId, sessionId, List.of(message));
    }

    /**
     * Appends messages in order in a single write. An empty list does nothing at all.
     */
    public void appendMessages(final String agentId, final String sessionId, final List<AgentMessage> messages) {
        if (null == messages || messages.isEmpty()) {
            return;
        }
        final var session = requireText(sessionId, "Session id is required");
        requireAgentFields(agentId);
        final var serialized = messages.stream().map(this::serialize).toList();
        final var now = now();
        ensureSession(agentId, session, now);
        dataStore.append(keys.messages(agentId, session), serialized);
        dataStore.setFields(keys.session(agentId, session), Map.of(FIELD_UPDATED_AT, now.toString(),
                                                                  FIELD_LAST_MESSAGE_AT, now.toString()));
        log.debug("Appended {} messages to {}/{}", serialized.size(), agentId, session);
    }

    public List<AgentMessage> getMessages(final String agentId, final String sessionId) {
        final var session = requireText(sessionId, "Session id is required");
        requireAgentFields(agentId);
        final var messages = new ArrayList<AgentMessage>();
        for (final var raw : dataStore.readList(keys.messages(agentId, session))) {
            try {
                messages.add(mapper.readValue(raw, AgentMessage.class));
            }
            catch (JsonProcessingException e) {
                log.warn("Skipping unreadable message in {}/{}: {}", agentId, session, e.getOriginalMessage());
            }
        }
        return messages;
    }

    /**
     * Deletes the transcript and zeroes the usage counters. The session itself is kept.
     */
    public void clearMessages(final String agentId, final String sessionId) {
        final var session = requireText(sessionId, "Session id is required");
        requireAgentFields(agentId);
        final var now = now();
        ensureSession(agentId, session, now);
        dataStore.delete(keys.messages(agentId, session));
        dataStore.setFields(keys.session(agentId, session), Map.of(
                FIELD_UPDATED_AT, now.toString(),
                FIELD_INPUT_TOKENS, "0",
                FIELD_REASONING_TOKENS, "0",
                FIELD_OUTPUT_TOKENS, "0",
                FIELD_TOTAL_TOKENS, "0"));
        log.info("Cleared session {}/{}", agentId, session);
    }

    public void startFresh(final String agentId) {
        clearMessages(agentId, Session.DEFAULT_SESSION_ID);
    }

    public SessionUsage getUsage(final String agentId, final String sessionId) {
        final var session = requireText(sessionId, "Session id is required");
        requireAgentFields(agentId);
        return toUsage(dataStore.getFields(keys.session(agentId, session)));
    }

    /**
     * Adds the delta to the session counters in one atomic step
     *
     * @return Session totals after the addition
     */
    public SessionUsage addUsage(final String agentId, final String sessionId, final SessionUsage delta) {
        final var session = requireText(sessionId, "Session id is required");
        if (null == delta) {
            throw CouncilException.invalidInput("Usage is required");
        }
        if (delta.hasNegativeCounter()) {
            throw CouncilException.invalidInput("Usage counters cannot be negative: " + delta);
        }
        requireAgentFields(agentId);
        final var now = now();
        ensureSession(agentId, session, now);
        final var totals = dataStore.incrementFields(keys.session(agentId, session), Map.of(
                FIELD_INPUT_TOKENS, delta.getInputTokens(),
                FIELD_REASONING_TOKENS, delta.getReasoningTokens(),
                FIELD_OUTPUT_TOKENS, delta.getOutputTokens(),
                FIELD_TOTAL_TOKENS, delta.getTotalTokens()));
        return SessionUsage.builder()
                .inputTokens(totals.getOrDefault(FIELD_INPUT_TOKENS, 0L))
                .reasoningTokens(totals.getOrDefault(FIELD_REASONING_TOKENS, 0L))
                .outputTokens(totals.getOrDefault(FIELD_OUTPUT_TOKENS, 0L))
                .totalTokens(totals.getOrDefault(FIELD_TOTAL_TOKENS, 0L))
                .build();
    }

    /**
     * Remote tool servers sorted by name, which is the order they are stored and connected in
     */
    public List<RemoteToolServerConfig> listServers(final String agentId) {
        return RemoteToolServerConfigs.parseStored(mapper, requireAgentFields(agentId).get(FIELD_SERVERS));
    }

    public List<RemoteToolServerConfig> addServer(final String agentId, final RemoteToolServerConfig config) {
        final var server = RemoteToolServerConfigs.normalize(config);
        return withAgentLock(agentId, () -> {
            final var servers = listServers(agentId);
            if (servers.stream().anyMatch(existing -> existing.getId().equals(server.getId()))) {
                throw CouncilException.conflict("Server id already exists: " + server.getId());
            }
            servers.add(server);
            servers.sort(RemoteToolServerConfigs.BY_NAME);
            saveServers(agentId, servers);
            log.info("Added server {} to agent {}", server.getId(), agentId);
            return List.copyOf(servers);
        });
    }

    public List<RemoteToolServerConfig> updateServer(
            final String agentId,
            final String serverId,
            final RemoteToolServerConfig config) {
        final var targetId = requireText(serverId, "Server id is required");
        final var server = RemoteToolServerConfigs.normalize(config);
        return withAgentLock(agentId, () -> {
            final var servers = listServers(agentId);
            final var index = indexOf(servers, targetId);
            if (index < 0) {
                throw CouncilException.notFound("Server " + targetId);
            }
            if (!server.getId().equals(targetId) && indexOf(servers, server.getId()) >= 0) {
                throw CouncilException.conflict("Server id already exists: " + server.getId());
            }
            servers.set(index, server);
            servers.sort(RemoteToolServerConfigs.BY_NAME);
            saveServers(agentId, servers);
            log.info("Updated server {} on agent {}", targetId, agentId);
            return List.copyOf(servers);
        });
    }

    public List<RemoteToolServerConfig> deleteServer(final String agentId, final String serverId) {
        final var targetId = requireText(serverId, "Server id is required");
        return withAgentLock(agentId, () -> {
            final var servers = listServers(agentId);
            final var index = indexOf(servers, targetId);
            if (index < 0) {
                throw CouncilException.notFound("Server " + targetId);
            }
            servers.remove(index);
            saveServers(agentId, servers);
            log.info("Deleted server {} from agent {}", targetId, agentId);
            servers.sort(RemoteToolServerConfigs.BY_NAME);
            return List.copyOf(servers);
        });
    }

    private void saveServers(final String agentId, final List<RemoteToolServerConfig> servers) {
        dataStore.setFields(keys.agent(agentId), Map.of(FIELD_SERVERS, RemoteToolServerConfigs.serialize(mapper, servers),
                                                        FIELD_UPDATED_AT, now().toString()));
    }

    private void ensureSession(final String agentId, final String sessionId, final Instant now) {
        final var sessionKey = keys.session(agentId, sessionId);
        final var lock = sessionLocks.get(sessionKey);
        lock.lock();
        try {
            dataStore.addToSet(keys.sessions(agentId), sessionId);
            if (!dataStore.exists(sessionKey)) {
                dataStore.setFields(sessionKey, Map.of(FIELD_ID, sessionId,
                                                       FIELD_AGENT_ID, agentId,
                                                       FIELD_CREATED_AT, now.toString(),
                                                       FIELD_UPDATED_AT, now.toString()));
                log.debug("Created session {}/{}", agentId, sessionId);
            }
            else {
                dataStore.setFields(sessionKey, Map.of(FIELD_UPDATED_AT, now.toString()));
            }
        }
        finally {
            lock.unlock();
        }
        dataStore.setFields(keys.agent(agentId), Map.of(FIELD_UPDATED_AT, now.toString()));
    }

    private Map<String, String> requireAgentFields(final String agentId) {
        if (Strings.isNullOrEmpty(agentId) || agentId.isBlank()) {
            throw CouncilException.invalidInput("Agent id is required");
        }
        final var fields = dataStore.getFields(keys.agent(agentId));
        if (Strings.isNullOrEmpty(fields.get(FIELD_ID)) || Strings.isNullOrEmpty(fields.get(FIELD_NAME))) {
            throw CouncilException.notFound("Agent " + agentId);
        }
        return fields;
    }

    private Optional<Agent> toAgent(final Map<String, String> fields) {
        final var id = fields.get(FIELD_ID);
        final var name = fields.get(FIELD_NAME);
        if (Strings.isNullOrEmpty(id) || Strings.isNullOrEmpty(name)) {
            return Optional.empty();
        }
        return Optional.of(Agent.builder()
                                   .id(id)
                                   .name(name)
                                   .systemPrompt(fields.get(FIELD_SYSTEM_PROMPT))
                                   .toolServers(List.copyOf(
                                           RemoteToolServerConfigs.parseStored(mapper, fields.get(FIELD_SERVERS))))
                                   .createdAt(instant(fields.get(FIELD_CREATED_AT)))
                                   .updatedAt(instant(fields.get(FIELD_UPDATED_AT)))
                                   .build());
    }

    private Session toSession(final String agentId, final String sessionId, final Map<String, String> fields) {
        return Session.builder()
                .id(sessionId)
                .agentId(agentId)
                .createdAt(instant(fields.get(FIELD_CREATED_AT)))
                .updatedAt(instant(fields.get(FIELD_UPDATED_AT)))
                .lastMessageAt(instant(fields.get(FIELD_LAST_MESSAGE_AT)))
                .usage(toUsage(fields))
                .build();
    }

    private static SessionUsage toUsage(final Map<String, String> fields) {
        return SessionUsage.builder()
                .inputTokens(counter(fields.get(FIELD_INPUT_TOKENS)))
                .reasoningTokens(counter(fields.get(FIELD_REASONING_TOKENS)))
                .outputTokens(counter(fields.get(FIELD_OUTPUT_TOKENS)))
                .totalTokens(counter(fields.get(FIELD_TOTAL_TOKENS)))
                .build();
    }

    private static long counter(final String value) {
        if (Strings.isNullOrEmpty(value)) {
            return 0L;
        }
        return Objects.requireNonNullElse(Longs.tryParse(value.trim()), 0L);
    }

    private static Instant instant(final String value) {
        if (Strings.isNullOrEmpty(value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        }
        catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable timestamp {}", value);
            return null;
        }
    }

    private static int indexOf(final List<RemoteToolServerConfig> servers, final String serverId) {
        for (int i = 0; i < servers.size(); i++) {
            if (servers.get(i).getId().equals(serverId)) {
                return i;
            }
        }
        return -1;
    }

    private static String requireText(final String value, final String message) {
        if (Strings.isNullOrEmpty(value) || value.isBlank()) {
            throw CouncilException.invalidInput(message);
        }
        return value.trim();
    }

    private String serialize(final AgentMessage message) {
        try {
            return mapper.writeValueAsString(message);
        }
        catch (JsonProcessingException e) {
            throw new CouncilException(CouncilError.error(ErrorType.SERIALIZATION_ERROR, e.getOriginalMessage()), e);
        }
    }

    private <T> T withAgentLock(final String agentId, final Supplier<T> action) {
        final var lock = agentLocks.get(keys.agent(agentId));
        lock.lock();
        try {
            return action.get();
        }
        finally {
            lock.unlock();
        }
    }

    private Instant now() {
        return clock.instant();
    }
}
