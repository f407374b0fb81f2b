/**
 * Copyright (c) 2014-2015 by Wen Yu.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *
 * Any modifications to this file must keep this entire header intact.
 *
 * Change History - most recent changes go on top of previous changes
 *
 * KeyBindings.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    11Dec2015  Modifier strokes
 * WY    09Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.keys;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key stroke bound to each {@link ViewerAction}. Actions without an explicit
 * binding use their default key.
 */
public class KeyBindings {
	private final Map<ViewerAction, Integer> overrides = new EnumMap<ViewerAction, Integer>(ViewerAction.class);

	/**
	 * @return the stroke bound to the action, see {@link KeyStrokes}
	 */
	public int getKey(ViewerAction action) {
		Integer key = overrides.get(action);
		return (key != null)? key.intValue() : action.getDefaultKey();
	}

	public boolean matches(ViewerAction action, int keyCode, int modifiersEx) {
		return KeyStrokes.matches(getKey(action), keyCode, modifiersEx);
	}

	public void reset() {
		overrides.clear();
	}

	public void reset(ViewerAction action) {
		overrides.remove(action);
	}

	public void setKey(ViewerAction action, int stroke) {
		if(action == null) throw new IllegalArgumentException("Null action");
		if(!KeyStrokes.isCapturable(KeyStrokes.keyCode(stroke)))
			throw new IllegalArgumentException("Key cannot be bound: " + stroke);
		if(stroke == action.getDefaultKey())
			overrides.remove(action);
		else
			overrides.put(action, stroke);
	}

	/**
	 * Every binding, defaults included, keyed by setting name in declaration order.
	 */
	public Map<String, Integer> toSettings() {
		Map<String, Integer> settings = new LinkedHashMap<String, Integer>();
		for(ViewerAction action : ViewerAction.values())
			settings.put(action.getSettingName(), getKey(action));
		return settings;
	}

	/**
	 * Builds bindings from stored settings. Unknown names, missing values and
	 * keys that cannot be bound are skipped so that those actions keep their defaults.
	 */
	public static KeyBindings fromSettings(Map<String, Integer> settings) {
		KeyBindings bindings = new KeyBindings();
		if(settings == null) return bindings;

		for(Map.Entry<String, Integer> entry : settings.entrySet()) {
			ViewerAction action = ViewerAction.fromSettingName(entry.getKey());
			Integer stroke = entry.getValue();
			if(action == null || stroke == null) continue;
			if(!KeyStrokes.isCapturable(KeyStrokes.keyCode(stroke))) continue;
			bindings.setKey(action, stroke);
		}

		return bindings;
	}
}
