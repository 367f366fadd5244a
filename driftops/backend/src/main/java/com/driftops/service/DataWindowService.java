package com.driftops.service;

import com.driftops.config.DriftProperties;
import com.driftops.exception.InvalidRequestException;
import com.driftops.model.DataProfile;
import com.driftops.model.LabeledMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the data the control loop works on: the reference corpus (and its profile), a
 * bounded window of live traffic used as the drift sample, and the labelled held-out set
 * used for candidate evaluation. The held-out set never overlaps the drift sample.
 */
@Slf4j
@Service
public class DataWindowService {

    private final ProfileBuilder profileBuilder;
    private final int windowSize;

    private final AtomicReference<Reference> reference = new AtomicReference<>();
    private final AtomicReference<List<LabeledMessage>> holdout = new AtomicReference<>(List.of());
    private final Deque<LabeledMessage> window = new ArrayDeque<>();

    public DataWindowService(ProfileBuilder profileBuilder, DriftProperties properties) {
        this.profileBuilder = profileBuilder;
        this.windowSize = Math.max(1, properties.getSampleWindowSize());
    }

    public DataProfile registerReference(List<LabeledMessage> corpus) {
        if (corpus == null || corpus.isEmpty()) {
            throw new InvalidRequestException("Reference corpus must contain at least one message");
        }
        List<LabeledMessage> copy = List.copyOf(corpus);
        DataProfile profile = profileBuilder.build(copy.stream().map(LabeledMessage::text).toList());
        reference.set(new Reference(copy, profile));
        log.info("Reference registered | messages={} | vocabulary={} | fingerprint={}",
            profile.messageCount(), profile.vocabulary().size(), profile.featureFingerprint());
        return profile;
    }

    public Optional<DataProfile> referenceProfile() {
        Reference current = reference.get();
        return current == null ? Optional.empty() : Optional.of(current.profile());
    }

    public List<LabeledMessage> referenceCorpus() {
        Reference current = reference.get();
        return current == null ? List.of() : current.corpus();
    }

    public int ingest(List<LabeledMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return windowSnapshot().size();
        }
        synchronized (window) {
            for (LabeledMessage message : messages) {
                if (message == null || message.text() == null) {
                    continue;
                }
                window.addLast(message);
                while (window.size() > windowSize) {
                    window.removeFirst();
                }
            }
            return window.size();
        }
    }

    public List<LabeledMessage> windowSnapshot() {
        synchronized (window) {
            return List.copyOf(window);
        }
    }

    public DataProfile sampleProfile() {
        return profileBuilder.build(windowSnapshot().stream().map(LabeledMessage::text).toList());
    }

    public void clearWindow() {
        synchronized (window) {
            window.clear();
        }
    }

    public void replaceHoldout(List<LabeledMessage> messages) {
        List<LabeledMessage> labelled = messages == null ? List.of()
            : messages.stream().filter(m -> m != null && m.isLabelled()).toList();
        if (labelled.isEmpty()) {
            throw new InvalidRequestException("Held-out set must contain labelled messages");
        }
        holdout.set(List.copyOf(labelled));
        log.info("Held-out set replaced | messages={}", labelled.size());
    }

    public List<LabeledMessage> holdout() {
        return holdout.get();
    }

    /**
     * Reference corpus plus every labelled message currently in the live window.
     */
    public List<LabeledMessage> trainingData() {
        List<LabeledMessage> data = new ArrayList<>(referenceCorpus());
        windowSnapshot().stream().filter(LabeledMessage::isLabelled).forEach(data::add);
        return data;
    }

    /**
     * After a promotion the data the new model was trained on becomes "normal".
     */
    public void rebaseReference(List<LabeledMessage> trainingData) {
        registerReference(trainingData);
        clearWindow();
    }

    private record Reference(List<LabeledMessage> corpus, DataProfile profile) {}
}
