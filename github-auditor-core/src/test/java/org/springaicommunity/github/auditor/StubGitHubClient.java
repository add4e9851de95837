package org.springaicommunity.github.auditor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory {@link GitHubClient} answering by path. Unknown paths answer 404. Queued
 * responses are consumed in order; the last one keeps answering.
 */
class StubGitHubClient implements GitHubClient {

	private final Map<String, Deque<GitHubResponse>> queued = new ConcurrentHashMap<>();

	private final Map<String, Function<Map<String, String>, GitHubResponse>> handlers = new ConcurrentHashMap<>();

	private final List<String> requests = Collections.synchronizedList(new ArrayList<>());

	StubGitHubClient on(String path, GitHubResponse... responses) {
		queued.put(path, new ArrayDeque<>(List.of(responses)));
		return this;
	}

	StubGitHubClient onJson(String path, String json) {
		return on(path, new GitHubResponse(200, json));
	}

	/**
	 * Serve the given JSON arrays as pages 1..n; later pages are empty.
	 */
	StubGitHubClient onPages(String path, String... pages) {
		return handle(path, query -> {
			int page = Integer.parseInt(query.getOrDefault("page", "1"));
			return new GitHubResponse(200, page <= pages.length ? pages[page - 1] : "[]");
		});
	}

	StubGitHubClient handle(String path, Function<Map<String, String>, GitHubResponse> handler) {
		handlers.put(path, handler);
		return this;
	}

	@Override
	public GitHubResponse get(String path, Map<String, String> query) {
		requests.add(query.isEmpty() ? path : path + "?" + query);
		Function<Map<String, String>, GitHubResponse> handler = handlers.get(path);
		if (handler != null) {
			return handler.apply(query);
		}
		Deque<GitHubResponse> responses = queued.get(path);
		if (responses == null) {
			return new GitHubResponse(404, "{\"message\":\"Not Found\"}");
		}
		synchronized (responses) {
			return responses.size() > 1 ? responses.poll() : responses.peek();
		}
	}

	List<String> requests() {
		synchronized (requests) {
			return List.copyOf(requests);
		}
	}

	long requestsTo(String path) {
		return requests().stream().filter(r -> r.equals(path) || r.startsWith(path + "?")).count();
	}

	static String jsonArray(int from, int count) {
		StringBuilder json = new StringBuilder("[");
		for (int i = 0; i < count; i++) {
			if (i > 0) {
				json.append(',');
			}
			json.append("{\"id\":").append(from + i).append('}');
		}
		return json.append(']').toString();
	}

}
