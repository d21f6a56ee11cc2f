package com.openforge.plantmate.stream;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Client stream tuning, bound from "plantmate.stream".
 *
 * @param queueCapacity  events buffered between the turn and a slow client
 * @param publishTimeout how long the turn may block on a full buffer before it is cancelled
 * @param emitterTimeout servlet async timeout; zero disables it
 */
@ConfigurationProperties(prefix = "plantmate.stream")
public record StreamProperties(
        @DefaultValue("64") int queueCapacity,
        @DefaultValue("30s") Duration publishTimeout,
        @DefaultValue("0s") Duration emitterTimeout
) {}
