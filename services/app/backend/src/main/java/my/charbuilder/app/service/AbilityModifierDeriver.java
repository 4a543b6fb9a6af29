package my.charbuilder.app.service;

import my.charbuilder.app.model.AbilityScore;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class AbilityModifierDeriver {

	/**
	 * Pairs every raw score with its modifier. Abilities without a stored score are left out.
	 */
	public Map<String, AbilityScore> deriveAbilities(Map<String, Integer> rawScores) {
		Map<String, AbilityScore> abilities = new LinkedHashMap<>();
		if (rawScores == null) {
			return Map.of();
		}
		rawScores.forEach((key, value) -> {
			if (value != null) {
				abilities.put(key, AbilityScore.of(value));
			}
		});
		return Collections.unmodifiableMap(abilities);
	}
}
