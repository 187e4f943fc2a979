package com.flagship.prior_auth.integration;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Scripted {@link WireTransport}: records every exchange and answers from a queue.
 * With the queue empty it repeats the last answer.
 */
public class RecordingWireTransport implements WireTransport {

    private final List<WireRequest> requests = new ArrayList<>();
    private final List<String> upstreams = new ArrayList<>();
    private final Deque<Supplier<WireResponse>> answers = new ArrayDeque<>();
    private Supplier<WireResponse> last;

    public synchronized RecordingWireTransport reply(String body) {
        answers.add(() -> new WireResponse(200, body));
        return this;
    }

    public synchronized RecordingWireTransport replyAfter(Duration delay, String body) {
        answers.add(() -> {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientIntegrationException("Interrupted before replying", true, e);
            }
            return new WireResponse(200, body);
        });
        return this;
    }

    public synchronized RecordingWireTransport fail(RuntimeException error) {
        answers.add(() -> {
            throw error;
        });
        return this;
    }

    @Override
    public WireResponse exchange(String upstream, WireRequest request) {
        Supplier<WireResponse> answer;
        synchronized (this) {
            requests.add(request);
            upstreams.add(upstream);
            if (!answers.isEmpty()) {
                last = answers.poll();
            }
            answer = last;
        }
        if (answer == null) {
            throw new IllegalStateException("No scripted reply for " + upstream);
        }
        return answer.get();
    }

    public synchronized int calls() {
        return requests.size();
    }

    public synchronized List<WireRequest> requests() {
        return List.copyOf(requests);
    }

    public synchronized WireRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    public synchronized List<String> upstreams() {
        return List.copyOf(upstreams);
    }
}
