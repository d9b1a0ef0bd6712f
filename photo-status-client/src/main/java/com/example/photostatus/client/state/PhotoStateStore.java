package com.example.photostatus.client.state;

import com.example.photostatus.shared.util.Constants.PhotoState;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The client's view of each photo: its visible state and whether it is still awaiting a terminal
 * notification. Once a photo is terminal only {@link #beginProcessing} can move it again, so a
 * late observation from the slower delivery path never overrides the first terminal one.
 */
@Slf4j
public class PhotoStateStore {

    private final Map<String, PhotoState> states = new ConcurrentHashMap<>();
    private final Set<String> pending = ConcurrentHashMap.newKeySet();
    private final List<PhotoStateListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(PhotoStateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PhotoStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Records an observed state.
     *
     * @return true if the visible state changed
     */
    public boolean applyState(String photoId, PhotoState state) {
        PhotoState[] previous = new PhotoState[1];
        boolean[] changed = new boolean[1];
        states.compute(photoId, (id, current) -> {
            previous[0] = current;
            if (current != null && current.isTerminal()) {
                return current;
            }
            changed[0] = current != state;
            return state;
        });
        if (!changed[0]) {
            if (previous[0] != null && previous[0].isTerminal() && previous[0] != state) {
                log.debug("Ignoring {} for photo {}: already {}", state.wireValue(), photoId, previous[0].wireValue());
            }
            return false;
        }
        notifyListeners(photoId, previous[0], state);
        return true;
    }

    /**
     * Starts a new processing run: the photo shows as in progress and becomes pending,
     * whatever it showed before.
     */
    public void beginProcessing(String photoId) {
        PhotoState previous = states.put(photoId, PhotoState.IN_PROGRESS);
        pending.add(photoId);
        if (previous != PhotoState.IN_PROGRESS) {
            notifyListeners(photoId, previous, PhotoState.IN_PROGRESS);
        }
    }

    public Optional<PhotoState> getState(String photoId) {
        return Optional.ofNullable(states.get(photoId));
    }

    public boolean isTerminal(String photoId) {
        PhotoState state = states.get(photoId);
        return state != null && state.isTerminal();
    }

    public void markPending(String photoId) {
        pending.add(photoId);
    }

    public void clearPending(String photoId) {
        pending.remove(photoId);
    }

    public boolean isPending(String photoId) {
        return pending.contains(photoId);
    }

    public Set<String> pendingPhotoIds() {
        return new LinkedHashSet<>(pending);
    }

    private void notifyListeners(String photoId, PhotoState previous, PhotoState current) {
        for (PhotoStateListener listener : listeners) {
            try {
                listener.onStateChanged(photoId, previous, current);
            } catch (RuntimeException e) {
                log.warn("Photo state listener failed for photo {}: {}", photoId, e.getMessage());
            }
        }
    }
}
