package com.example.vidres.service;

import com.example.vidres.domain.ProcessedVideo;
import com.example.vidres.exceptions.DeliveryException;

public interface ResultDeliveryService {

    /**
     * Sends the processed renditions back to a user.
     *
     * @return number of renditions delivered
     * @throws DeliveryException if nothing could be delivered
     */
    int deliverResult(long userId, String jobId, ProcessedVideo result) throws DeliveryException;

    /**
     * Replaces the original channel post with the processed video.
     */
    void replaceInPlace(long channelId, long messageId, ProcessedVideo result) throws DeliveryException;
}
