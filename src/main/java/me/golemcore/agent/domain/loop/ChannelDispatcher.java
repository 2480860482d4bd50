package me.golemcore.agent.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.InboundMessage;
import me.golemcore.agent.infrastructure.config.BotProperties;
import me.golemcore.agent.port.inbound.ChannelPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connects channel receive streams to the {@link AgentLoop}.
 *
 * <p>
 * Messages of one channel are processed strictly one after another on a worker
 * scheduler, so a channel never has two turns in flight. Different channels
 * run independently. A turn that throws is logged and the channel keeps
 * listening.
 */
@Component
@Slf4j
public class ChannelDispatcher {

    private final ObjectProvider<ChannelPort> channelProvider;
    private final AgentLoop agentLoop;
    private final BotProperties properties;
    private final Scheduler scheduler;
    private final Map<String, Running> running = new ConcurrentHashMap<>();

    @Autowired
    public ChannelDispatcher(ObjectProvider<ChannelPort> channelProvider, AgentLoop agentLoop,
            BotProperties properties) {
        this(channelProvider, agentLoop, properties, Schedulers.boundedElastic());
    }

    ChannelDispatcher(ObjectProvider<ChannelPort> channelProvider, AgentLoop agentLoop,
            BotProperties properties, Scheduler scheduler) {
        this.channelProvider = channelProvider;
        this.agentLoop = agentLoop;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    /**
     * Starts every channel enabled under {@code bot.channels.<type>.enabled}.
     */
    public void startEnabledChannels() {
        channelProvider.orderedStream().forEach(channel -> {
            if (isChannelEnabled(channel.getChannelType())) {
                start(channel);
            } else {
                log.debug("[Channels] Channel disabled: {}", channel.getChannelType());
            }
        });
    }

    public void start(ChannelPort channel) {
        String type = channel.getChannelType();
        if (running.containsKey(type)) {
            log.warn("[Channels] Channel already running: {}", type);
            return;
        }
        log.info("[Channels] Starting channel: {}", type);
        channel.start();
        Disposable subscription = channel.receive()
                .concatMap(inbound -> Mono.fromRunnable(() -> dispatch(channel, inbound))
                        .subscribeOn(scheduler))
                .subscribe(
                        ignored -> {
                        },
                        error -> log.error("[Channels] Receive stream of {} failed", type, error),
                        () -> log.info("[Channels] Receive stream of {} completed", type));
        running.put(type, new Running(channel, subscription));
    }

    @PreDestroy
    public void stopAll() {
        running.forEach((type, entry) -> {
            log.info("[Channels] Stopping channel: {}", type);
            entry.subscription().dispose();
            try {
                entry.channel().stop();
            } catch (RuntimeException e) {
                log.warn("[Channels] Failed to stop channel {}: {}", type, e.getMessage());
            }
        });
        running.clear();
    }

    public boolean isRunning(String channelType) {
        return running.containsKey(channelType);
    }

    private void dispatch(ChannelPort channel, InboundMessage inbound) {
        try {
            agentLoop.processMessage(channel, inbound);
        } catch (RuntimeException e) {
            log.error("[Channels] Turn failed for {}", inbound.getSession(), e);
        }
    }

    private boolean isChannelEnabled(String channelType) {
        BotProperties.ChannelProperties channelProps = properties.getChannels().get(channelType);
        return channelProps != null && channelProps.isEnabled();
    }

    private record Running(ChannelPort channel, Disposable subscription) {
    }
}
