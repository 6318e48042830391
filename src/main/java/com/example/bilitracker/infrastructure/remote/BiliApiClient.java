package com.example.bilitracker.infrastructure.remote;

import com.example.bilitracker.domain.model.CollectionInfo;
import com.example.bilitracker.domain.model.CollectionReference;
import com.example.bilitracker.domain.model.RemoteVideo;
import java.util.List;

/**
 * Read-only access to the provider's collection endpoints.
 */
public interface BiliApiClient {

    /**
     * @param type {@code series} or {@code season}
     * @return normalized metadata, or null when the provider answers without it
     * @throws com.example.bilitracker.common.exception.RemoteApiException when every attempt failed
     * @throws com.example.bilitracker.common.exception.ValidationException for an unsupported type
     */
    CollectionInfo fetchInfo(String type, String remoteId, String ownerId);

    /**
     * Newest videos first, at most {@code count}. Remote failures yield an empty list.
     */
    List<RemoteVideo> fetchLatestVideos(String type, String remoteId, String ownerId, int count);

    /**
     * @throws com.example.bilitracker.common.exception.ValidationException when the URL does not name a collection
     */
    CollectionReference parseReference(String url);
}
