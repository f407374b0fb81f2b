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
 * ShortcutDialog.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    11Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

import java.awt.BorderLayout;
import java.awt.FlowLayout;
import java.awt.Frame;
import java.awt.GridLayout;
import java.awt.event.ActionEvent;
import java.awt.event.ActionListener;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JDialog;
import javax.swing.JLabel;
import javax.swing.JPanel;

import com.github.dragon66.imageviewer.keys.KeyBindings;
import com.github.dragon66.imageviewer.keys.ViewerAction;

/**
 * Modal dialog listing every action with a field to rebind it.
 */
public class ShortcutDialog extends JDialog {

	private static final long serialVersionUID = -6170356393287417786L;

	private final Map<ViewerAction, KeyInputField> fields = new EnumMap<ViewerAction, KeyInputField>(ViewerAction.class);
	private KeyBindings result;

	private ShortcutDialog(Frame owner, KeyBindings current) {
		super(owner, "Keyboard Shortcuts", true);

		JPanel rows = new JPanel(new GridLayout(0, 2, 8, 4));
		rows.setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10));

		for(ViewerAction action : ViewerAction.values()) {
			KeyInputField field = new KeyInputField();
			field.setStroke(current.getKey(action));
			fields.put(action, field);
			rows.add(new JLabel(labelFor(action)));
			rows.add(field);
		}

		JButton defaults = new JButton("Restore Defaults");
		defaults.addActionListener(new ActionListener() {
			public void actionPerformed(ActionEvent e) {
				for(Map.Entry<ViewerAction, KeyInputField> entry : fields.entrySet())
					entry.getValue().setStroke(entry.getKey().getDefaultKey());
			}
		});

		JButton ok = new JButton("OK");
		ok.addActionListener(new ActionListener() {
			public void actionPerformed(ActionEvent e) {
				result = collectBindings();
				dispose();
			}
		});

		JButton cancel = new JButton("Cancel");
		cancel.addActionListener(new ActionListener() {
			public void actionPerformed(ActionEvent e) {
				dispose();
			}
		});

		JPanel buttons = new JPanel(new FlowLayout(FlowLayout.RIGHT));
		buttons.add(defaults);
		buttons.add(ok);
		buttons.add(cancel);

		getContentPane().add(rows, BorderLayout.CENTER);
		getContentPane().add(buttons, BorderLayout.SOUTH);
		getRootPane().setDefaultButton(ok);
		pack();
		setLocationRelativeTo(owner);
	}

	private KeyBindings collectBindings() {
		KeyBindings bindings = new KeyBindings();
		for(Map.Entry<ViewerAction, KeyInputField> entry : fields.entrySet()) {
			int stroke = entry.getValue().getStroke();
			if(stroke != KeyInputField.NO_STROKE)
				bindings.setKey(entry.getKey(), stroke);
		}
		return bindings;
	}

	static String labelFor(ViewerAction action) {
		String name = action.name().replace('_', ' ').toLowerCase(Locale.ROOT);
		return Character.toUpperCase(name.charAt(0)) + name.substring(1);
	}

	/**
	 * Shows the dialog and waits for it to close.
	 *
	 * @return the edited bindings, or null if the dialog was cancelled
	 */
	public static KeyBindings showDialog(Frame owner, KeyBindings current) {
		ShortcutDialog dialog = new ShortcutDialog(owner, current);
		dialog.setVisible(true);
		return dialog.result;
	}
}
