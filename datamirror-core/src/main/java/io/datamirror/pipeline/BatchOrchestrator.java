package io.datamirror.pipeline;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datamirror.assets.AssetManifest;
import io.datamirror.events.EventSink;
import io.datamirror.events.MirrorEvent;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/// Runs every asset of a manifest through an {@link AssetHandler} on a fixed size pool.
///
/// Assets are submitted in manifest order and their outcomes consumed as they complete.
/// One asset failing never stops the others.
public class BatchOrchestrator {
    private final AssetHandler handler;
    private final ObjectMapper mapper;
    private final EventSink events;

    public BatchOrchestrator(AssetHandler handler, EventSink events) {
        this(handler, new ObjectMapper(), events);
    }

    public BatchOrchestrator(AssetHandler handler, ObjectMapper mapper, EventSink events) {
        this.handler = handler;
        this.mapper = mapper;
        this.events = events;
    }

    /// Processes the assets listed in a manifest file.
    ///
    /// @param manifestPath The manifest snapshot
    /// @param concurrency The number of worker threads, at least 1
    /// @return the batch report, flagged as rejected when the manifest is not a JSON list
    /// @throws IOException if the manifest file cannot be read
    public BatchReport processAssets(Path manifestPath, int concurrency) throws IOException {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(manifestPath)) {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            events.log(MirrorEvent.MF_UNREADABLE, "path", manifestPath, "cause", e.getOriginalMessage());
            return BatchReport.rejected();
        }
        if (root == null || !root.isArray()) {
            String found = root == null || root.isMissingNode() ? "nothing" : root.getNodeType().name();
            events.log(MirrorEvent.MF_NOT_A_LIST, "path", manifestPath, "found", found);
            return BatchReport.rejected();
        }

        AssetManifest manifest = AssetManifest.fromRecords(root, events);
        events.log(MirrorEvent.BT_FOUND, "count", manifest.size());

        List<AssetOutcome> outcomes = new ArrayList<>(manifest.size());
        int poolErrors = 0;
        ExecutorService executor = Executors.newFixedThreadPool(concurrency, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "asset-worker-" + counter.incrementAndGet());
                t.setDaemon(false);
                return t;
            }
        });
        try {
            CompletionService<AssetOutcome> completion = new ExecutorCompletionService<>(executor);
            for (String assetId : manifest.assetIds()) {
                completion.submit(() -> handler.processSingleAsset(assetId));
            }
            for (int i = 0; i < manifest.size(); i++) {
                try {
                    AssetOutcome outcome = completion.take().get();
                    events.log(MirrorEvent.AS_OUTCOME, "assetId", outcome.assetId(), "outcome", outcome.describe());
                    outcomes.add(outcome);
                } catch (ExecutionException e) {
                    poolErrors++;
                    events.log(MirrorEvent.BT_TASK_FAILED, "cause", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            events.warn("Interrupted with {} of {} assets complete", outcomes.size() + poolErrors, manifest.size());
            executor.shutdownNow();
        } finally {
            executor.shutdown();
        }

        BatchReport report = new BatchReport(manifest.size(), manifest.skippedRecords(), outcomes, poolErrors, false);
        events.log(MirrorEvent.BT_SUMMARY,
            "found", report.assetsFound(),
            "skipped", report.skippedRecords(),
            "processed", report.count(OutcomeStatus.PROCESSED_OK),
            "done", report.count(OutcomeStatus.ALREADY_DONE),
            "noDetails", report.count(OutcomeStatus.NO_DETAILS),
            "errors", report.count(OutcomeStatus.PROCESSING_ERROR) + report.poolErrors(),
            "downloaded", report.payloadsDownloaded(),
            "failed", report.payloadsFailed());
        return report;
    }
}
