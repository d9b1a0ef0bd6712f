package com.example.photostatus.client.state;

import com.example.photostatus.shared.util.Constants.PhotoState;

@FunctionalInterface
public interface PhotoStateListener {

    /**
     * @param previous the state before the change, null for a photo seen for the first time
     */
    void onStateChanged(String photoId, PhotoState previous, PhotoState current);
}
