package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Encodes {@link AuditEvent}s as JSON objects and server-sent-event frames.
 *
 * <p>
 * Example frames for the repository audit:
 *
 * <pre>
 * data: {"type":"start","total_repos":3}
 *
 * data: {"type":"progress","repo":"api","processed":1}
 *
 * data: {"type":"data","repo_data":{...}}
 *
 * data: {"type":"done"}
 * </pre>
 */
public class AuditEventCodec {

	private final ObjectMapper objectMapper;

	private final EventVocabulary vocabulary;

	public AuditEventCodec(ObjectMapper objectMapper, EventVocabulary vocabulary) {
		this.objectMapper = objectMapper;
		this.vocabulary = vocabulary;
	}

	public ObjectNode toJson(AuditEvent event) {
		ObjectNode node = objectMapper.createObjectNode();
		node.put("type", event.type().wireName());
		switch (event.type()) {
			case START:
				node.put(vocabulary.totalField(), event.total());
				break;
			case PROGRESS:
				node.put(vocabulary.subjectField(), event.subject());
				node.put("processed", event.processed());
				break;
			case DATA:
				node.set(vocabulary.dataField(), objectMapper.valueToTree(event.payload()));
				break;
			case ERROR:
				node.put("detail", event.detail());
				break;
			default:
				break;
		}
		return node;
	}

	/**
	 * Encode one event as a {@code data: <json>\n\n} frame.
	 */
	public String frame(AuditEvent event) {
		try {
			return "data: " + objectMapper.writeValueAsString(toJson(event)) + "\n\n";
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to encode " + event.type().wireName() + " event", e);
		}
	}

}
