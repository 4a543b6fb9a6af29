package my.charbuilder.app.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory sink for content problems found during one derivation pass. Messages are logged and kept so
 * callers can show them next to the character.
 */
public class DerivationDiagnostics {
	private static final Logger logger = LoggerFactory.getLogger(DerivationDiagnostics.class);

	private final String characterId;
	private final List<String> messages = new ArrayList<>();

	public DerivationDiagnostics(String characterId) {
		this.characterId = characterId;
	}

	public void warn(String message) {
		logger.warn("Derivation advisory (character={}): {}", characterId, message);
		messages.add(message);
	}

	public List<String> messages() {
		return List.copyOf(messages);
	}
}
