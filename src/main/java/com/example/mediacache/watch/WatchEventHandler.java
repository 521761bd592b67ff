package com.example.mediacache.watch;

import com.example.mediacache.MediaCacheException;

/**
 * Receives settled changes of the media tree as relative, forward-slash keys.
 */
public interface WatchEventHandler {
    /**
     * A file was created or rewritten and has stopped changing. Throwing
     * {@link com.example.mediacache.FileLockedException} asks the watcher to retry later.
     */
    void fileAdded(String relativePath) throws MediaCacheException;

    /**
     * A file's content changed, before it has settled. Called for every create or modify
     * event, in order with the other callbacks.
     */
    void fileChanged(String relativePath) throws MediaCacheException;

    void fileRemoved(String relativePath) throws MediaCacheException;

    void directoryRemoved(String relativePath) throws MediaCacheException;
}
