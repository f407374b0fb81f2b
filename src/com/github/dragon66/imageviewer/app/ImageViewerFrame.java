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
 * ImageViewerFrame.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    14Dec2015  Settings saved on close
 * WY    13Dec2015  Folder navigation and delete
 * WY    11Dec2015  Keyboard dispatch
 * WY    05Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

import java.awt.BorderLayout;
import java.awt.Cursor;
import java.awt.FlowLayout;
import java.awt.KeyEventDispatcher;
import java.awt.KeyboardFocusManager;
import java.awt.event.ActionEvent;
import java.awt.event.ActionListener;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import java.awt.event.KeyEvent;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.File;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JFileChooser;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JMenu;
import javax.swing.JMenuBar;
import javax.swing.JMenuItem;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JSlider;
import javax.swing.SwingUtilities;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.filechooser.FileNameExtensionFilter;

import com.github.dragon66.imageviewer.keys.DispatchResult;
import com.github.dragon66.imageviewer.keys.KeyBindings;
import com.github.dragon66.imageviewer.keys.KeyDispatcher;
import com.github.dragon66.imageviewer.keys.ViewerAction;
import com.github.dragon66.imageviewer.keys.ViewerCommands;
import com.github.dragon66.imageviewer.media.MediaSource;
import com.github.dragon66.imageviewer.media.MediaType;
import com.github.dragon66.imageviewer.playback.AnimationHandler;
import com.github.dragon66.imageviewer.playback.SwingTickSource;
import com.github.dragon66.imageviewer.playback.ViewerHost;

/**
 * The viewer window: image area, playback bar, volume controls and status line.
 */
public class ImageViewerFrame extends JFrame implements ViewerCommands, ViewerHost {

	private static final long serialVersionUID = -2925427208106553045L;

	private static final Logger LOGGER = Logger.getLogger(ImageViewerFrame.class.getName());
	private static final String BASE_LOGGER = "com.github.dragon66.imageviewer";
	private static final String TITLE = "Image Viewer";
	private static final String PLAY_TEXT = "▶";
	private static final String PAUSE_TEXT = "❚❚";

	private final ViewerSettings settings;
	private final File settingsFile;
	private final ImageLabel imageLabel = new ImageLabel();
	private final PlaybackSlider playbackSlider = new PlaybackSlider();
	private final JButton playButton = new JButton(PLAY_TEXT);
	private final JButton muteButton = new JButton();
	private final JSlider volumeSlider = new JSlider(0, VolumeControl.MAX_VOLUME);
	private final JLabel statusLabel = new JLabel(" ");
	private final VolumeControl volumeControl;
	private final AnimationHandler animationHandler;
	private final KeyDispatcher keyDispatcher;

	private ImageFolder folder;
	private MediaType currentMediaType = MediaType.FAILED;
	private boolean fullScreen;
	private boolean debugMode;
	private boolean updatingVolume;

	public ImageViewerFrame(ViewerSettings settings, File settingsFile) {
		super(TITLE);
		this.settings = settings;
		this.settingsFile = settingsFile;
		this.volumeControl = new VolumeControl(settings.getVolume(), settings.isMuted());
		this.animationHandler = new AnimationHandler(imageLabel, playbackSlider, this, new SwingTickSource());
		this.animationHandler.setSpeed(settings.getPlaybackSpeed());
		this.keyDispatcher = new KeyDispatcher(settings.getKeyBindings(), this);

		setDefaultCloseOperation(JFrame.DO_NOTHING_ON_CLOSE);
		setJMenuBar(createMenuBar());
		getContentPane().add(imageLabel, BorderLayout.CENTER);
		getContentPane().add(createControlPanel(), BorderLayout.SOUTH);

		imageLabel.addComponentListener(new ComponentAdapter() {
			public void componentResized(ComponentEvent e) {
				animationHandler.rescale();
			}
		});

		addWindowListener(new WindowAdapter() {
			public void windowClosing(WindowEvent evt) {
				close();
			}
		});

		KeyboardFocusManager.getCurrentKeyboardFocusManager().addKeyEventDispatcher(new ViewerKeyDispatcher());
		updateVolumeControls();
	}

	public void adjustVolume(int volume) {
		volumeControl.setVolume(volume);
		updateVolumeControls();
		showMessage("Volume: " + volumeControl.getVolume() + "%");
	}

	public void cleanupCurrentMedia() {
		animationHandler.cleanup();
		currentMediaType = MediaType.FAILED;
		playButton.setText(PLAY_TEXT);
	}

	/**
	 * Releases the current image, saves the settings and exits.
	 */
	public void close() {
		animationHandler.cleanup();
		saveSettings();
		dispose();
		System.exit(0);
	}

	private JPanel createControlPanel() {
		playButton.setFocusable(false);
		playButton.addActionListener(new ActionListener() {
			public void actionPerformed(ActionEvent e) {
				toggleAnimationPlayback();
			}
		});

		muteButton.setFocusable(false);
		muteButton.addActionListener(new ActionListener() {
			public void actionPerformed(ActionEvent e) {
				toggleMute();
			}
		});

		volumeSlider.setFocusable(false);
		volumeSlider.addChangeListener(new ChangeListener() {
			public void stateChanged(ChangeEvent e) {
				if(!updatingVolume) volumeControl.setVolume(volumeSlider.getValue());
			}
		});

		JPanel playback = new JPanel(new BorderLayout(5, 0));
		playback.add(playButton, BorderLayout.WEST);
		playback.add(playbackSlider, BorderLayout.CENTER);

		JPanel volume = new JPanel(new FlowLayout(FlowLayout.RIGHT, 5, 0));
		volume.add(muteButton);
		volume.add(volumeSlider);
		playback.add(volume, BorderLayout.EAST);

		JPanel panel = new JPanel(new BorderLayout());
		panel.setBorder(BorderFactory.createEmptyBorder(4, 6, 4, 6));
		panel.add(playback, BorderLayout.CENTER);
		panel.add(statusLabel, BorderLayout.SOUTH);

		return panel;
	}

	private JMenuBar createMenuBar() {
		JMenu fileMenu = new JMenu("File");

		JMenuItem open = new JMenuItem("Open...");
		open.addActionListener(new ActionListener() {
			public void actionPerformed(ActionEvent e) {
				chooseFile();
			}
		});
		fileMenu.add(open);

		JMenuItem shortcuts = new JMenuItem("Keyboard Shortcuts...");
		shortcuts.addActionListener(new ActionListener() {
			public void actionPerformed(ActionEvent e) {
				editShortcuts();
			}
		});
		fileMenu.add(shortcuts);
		fileMenu.addSeparator();

		JMenuItem exit = new JMenuItem("Exit");
		exit.addActionListener(new ActionListener() {
			public void actionPerformed(ActionEvent e) {
				close();
			}
		});
		fileMenu.add(exit);

		JMenuBar menuBar = new JMenuBar();
		menuBar.add(fileMenu);

		return menuBar;
	}

	private void chooseFile() {
		JFileChooser chooser = new JFileChooser(settings.getLastDirectory());
		chooser.setFileFilter(new FileNameExtensionFilter("Images", ImageFolder.EXTENSIONS.toArray(new String[0])));
		if(chooser.showOpenDialog(this) == JFileChooser.APPROVE_OPTION)
			openFile(chooser.getSelectedFile());
	}

	public void deleteCurrentImage() {
		File current = (folder == null)? null : folder.getCurrent();
		if(current == null) return;

		int answer = JOptionPane.showConfirmDialog(this, "Delete " + current.getName() + "?",
				"Delete File", JOptionPane.YES_NO_OPTION, JOptionPane.WARNING_MESSAGE);
		if(answer != JOptionPane.YES_OPTION) return;

		cleanupCurrentMedia();

		try {
			File next = folder.deleteCurrent();
			showMessage("Deleted " + current.getName());
			if(next != null)
				loadCurrent();
			else
				updateImageInfo();
		} catch(IOException e) {
			LOGGER.log(Level.WARNING, "Failed to delete " + current, e);
			showMessage("Failed to delete: " + current.getName());
			loadCurrent();
		}
	}

	private void editShortcuts() {
		KeyBindings edited = ShortcutDialog.showDialog(this, keyDispatcher.getBindings());
		if(edited == null) return;
		KeyBindings bindings = keyDispatcher.getBindings();
		bindings.reset();
		for(ViewerAction action : ViewerAction.values())
			bindings.setKey(action, edited.getKey(action));
		settings.setKeyBindings(bindings);
		saveSettings();
		showMessage("Keyboard shortcuts saved");
	}

	public int getVolume() {
		return volumeControl.getVolume();
	}

	public void hideLoadingIndicator() {
		setCursor(Cursor.getDefaultCursor());
	}

	public boolean isAnimationActive() {
		return currentMediaType.isAnimation() && animationHandler.getCurrentSource() != null;
	}

	public boolean isFullScreen() {
		return fullScreen;
	}

	private void loadCurrent() {
		File file = folder.getCurrent();
		currentMediaType = animationHandler.load(file);
		if(!currentMediaType.isAnimation())
			playButton.setText(PLAY_TEXT);
	}

	/**
	 * Shows a file and makes its directory the one browsed with previous and next.
	 */
	public void openFile(File file) {
		folder = ImageFolder.forFile(file);
		settings.setLastDirectory(file.getAbsoluteFile().getParentFile());
		loadCurrent();
	}

	public void playbackStateChanged(boolean playing) {
		playButton.setText(playing? PAUSE_TEXT : PLAY_TEXT);
	}

	public void rotateImage(boolean clockwise) {
		if(!animationHandler.rotate(clockwise))
			showMessage("No image to rotate");
	}

	private void saveSettings() {
		settings.setVolume(volumeControl.getVolume());
		settings.setMuted(volumeControl.isMuted());
		settings.setPlaybackSpeed(animationHandler.getSpeed());
		if(settingsFile == null) return;
		try {
			settings.save(settingsFile);
		} catch(IOException e) {
			LOGGER.log(Level.WARNING, "Failed to save settings to " + settingsFile, e);
		}
	}

	public void showLoadingIndicator() {
		setCursor(Cursor.getPredefinedCursor(Cursor.WAIT_CURSOR));
	}

	public void showMessage(String message) {
		statusLabel.setText(message);
		LOGGER.info(message);
	}

	public void showNextImage() {
		if(folder == null || folder.next() == null) return;
		loadCurrent();
	}

	public void showPreviousImage() {
		if(folder == null || folder.previous() == null) return;
		loadCurrent();
	}

	public void toggleAnimationPlayback() {
		if(!isAnimationActive()) {
			showMessage("Nothing to play");
			return;
		}
		showMessage(animationHandler.togglePlayback()? "Playing" : "Paused");
	}

	public void toggleDebugMode() {
		debugMode = !debugMode;
		Logger.getLogger(BASE_LOGGER).setLevel(debugMode? Level.FINE : Level.INFO);
		showMessage("Debug mode " + (debugMode? "on" : "off"));
	}

	public void toggleFullScreen() {
		fullScreen = !fullScreen;
		dispose();
		setUndecorated(fullScreen);
		getJMenuBar().setVisible(!fullScreen);
		setExtendedState(fullScreen? JFrame.MAXIMIZED_BOTH : JFrame.NORMAL);
		setVisible(true);
	}

	public void toggleMute() {
		boolean muted = volumeControl.toggleMute();
		updateVolumeControls();
		showMessage(muted? "Muted" : "Volume: " + volumeControl.getVolume() + "%");
	}

	public void updateImageInfo() {
		MediaSource source = animationHandler.getCurrentSource();
		if(source == null || folder == null) {
			setTitle(TITLE);
			return;
		}
		StringBuilder title = new StringBuilder(source.getFile().getName());
		title.append(" (").append(folder.getIndex() + 1).append('/').append(folder.size()).append(')');
		title.append(" - ").append(source.getFrame(0).getWidth()).append('x').append(source.getFrame(0).getHeight());
		if(source.isAnimated())
			title.append(", ").append(source.getFrameCount()).append(" frames");
		int degrees = animationHandler.getRotation().getDegrees();
		if(degrees != 0)
			title.append(", ").append(degrees).append('°');
		setTitle(title.append(" - ").append(TITLE).toString());
	}

	private void updateVolumeControls() {
		updatingVolume = true;
		try {
			volumeSlider.setValue(volumeControl.getVolume());
		} finally {
			updatingVolume = false;
		}
		volumeSlider.setEnabled(!volumeControl.isMuted());
		muteButton.setText(volumeControl.isMuted()? "Unmute" : "Mute");
	}

	private class ViewerKeyDispatcher implements KeyEventDispatcher {
		public boolean dispatchKeyEvent(KeyEvent e) {
			if(e.getID() != KeyEvent.KEY_PRESSED || !isFocused()) return false;
			// Shortcut fields in dialogs get their own keys
			if(e.getComponent() instanceof KeyInputField) return false;
			if(SwingUtilities.getWindowAncestor(e.getComponent()) != ImageViewerFrame.this
					&& e.getComponent() != ImageViewerFrame.this) return false;
			return keyDispatcher.dispatch(e.getKeyCode(), e.getModifiersEx()) == DispatchResult.HANDLED;
		}
	}
}
