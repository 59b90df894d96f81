/*
 * Copyright (C) 2025 Relevo Orchestrator
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.relevo.application.orchestration;

import com.relevo.domain.model.RemoteResource;
import com.relevo.domain.model.ResourceAuth;
import com.relevo.domain.model.ResourceTier;
import com.relevo.infrastructure.transport.TransportRequest;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourceRequestFactoryTest {
    private final Map<String, String> secrets = Map.of(
            "NEWS_KEY", "n3ws",
            "INFURA_KEY", "abc123",
            "CMC_KEY", "cmc-secret",
            "ODD_PATH_KEY", "ab/c d",
            "ODD_QUERY_KEY", "a+b/c d&e=f"
    );
    private final ResourceRequestFactory factory = new ResourceRequestFactory(name -> Optional.ofNullable(secrets.get(name)));

    @Test
    void joinsPathAndForwardsQueryParams() {
        RemoteResource resource = RemoteResource.open("gecko", "market_data", "https://api.gecko.example/api/v3/", ResourceTier.CRITICAL);
        RequestSpec spec = RequestSpec.get("/simple/price").withQueryParam("ids", "bitcoin").withQueryParam("vs_currencies", "usd");

        TransportRequest request = factory.build(resource, spec, Duration.ofSeconds(3));

        assertEquals("https://api.gecko.example/api/v3/simple/price?ids=bitcoin&vs_currencies=usd", request.uri().toString());
        assertEquals(Duration.ofSeconds(3), request.timeout());
    }

    @Test
    void attachesQueryHeaderAndPathCredentials() {
        RemoteResource query = new RemoteResource("newsapi", null, "news", "https://newsapi.example/v2", ResourceTier.MEDIUM,
                new ResourceAuth.QueryKey("apiKey", "NEWS_KEY"), null, false);
        RemoteResource header = new RemoteResource("cmc", null, "market_data", "https://cmc.example/v1", ResourceTier.LOW,
                new ResourceAuth.HeaderKey("X-CMC_PRO_API_KEY", "CMC_KEY"), null, false);
        RemoteResource path = new RemoteResource("infura", null, "rpc", "https://mainnet.example/v3/{key}", ResourceTier.CRITICAL,
                new ResourceAuth.PathKey("INFURA_KEY"), null, false);

        assertEquals("https://newsapi.example/v2/everything?q=btc&apiKey=n3ws",
                factory.build(query, RequestSpec.get("everything").withQueryParam("q", "btc"), Duration.ofSeconds(1)).uri().toString());
        assertEquals("cmc-secret",
                factory.build(header, RequestSpec.get("quotes"), Duration.ofSeconds(1)).headers().get("X-CMC_PRO_API_KEY"));
        assertEquals("https://mainnet.example/v3/abc123",
                factory.build(path, RequestSpec.get(""), Duration.ofSeconds(1)).uri().toString());
    }

    @Test
    void pathSecretIsEncodedOnceAsASingleSegment() {
        RemoteResource path = new RemoteResource("rpc", null, "rpc", "https://rpc.example/v3/{key}", ResourceTier.CRITICAL,
                new ResourceAuth.PathKey("ODD_PATH_KEY"), null, false);

        URI uri = factory.build(path, RequestSpec.get(""), Duration.ofSeconds(1)).uri();

        assertEquals("/v3/ab%2Fc%20d", uri.getRawPath());
        assertEquals("/v3/ab/c d", uri.getPath());
    }

    @Test
    void querySecretAndForwardedValuesAreStrictlyEncoded() {
        RemoteResource query = new RemoteResource("news", null, "news", "https://news.example/v2", ResourceTier.MEDIUM,
                new ResourceAuth.QueryKey("apiKey", "ODD_QUERY_KEY"), null, false);
        RequestSpec spec = RequestSpec.get("top headlines").withQueryParam("q", "btc+eth");

        URI uri = factory.build(query, spec, Duration.ofSeconds(1)).uri();

        assertEquals("/v2/top%20headlines", uri.getRawPath());
        assertEquals("q=btc%2Beth&apiKey=a%2Bb%2Fc%20d%26e%3Df", uri.getRawQuery());
    }

    @Test
    void missingSecretMakesResourceUnconfiguredUnlessOverridden() {
        RemoteResource resource = new RemoteResource("etherscan", null, "explorer", "https://etherscan.example/api", ResourceTier.HIGH,
                new ResourceAuth.QueryKey("apikey", "ETHERSCAN_KEY"), null, false);
        RequestSpec plain = RequestSpec.get("");
        RequestSpec overridden = new RequestSpec("GET", "", Map.of(), Map.of(), null, "given", false);

        assertFalse(factory.isConfigured(resource, plain));
        assertTrue(factory.isConfigured(resource, overridden));
        assertEquals("https://etherscan.example/api?apikey=given",
                factory.build(resource, overridden, Duration.ofSeconds(1)).uri().toString());
    }
}
