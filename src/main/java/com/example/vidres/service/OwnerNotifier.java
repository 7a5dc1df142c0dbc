package com.example.vidres.service;

import com.example.vidres.domain.JobState;
import com.example.vidres.domain.OwnerKey;

/**
 * Fire-and-forget notices. Implementations never throw.
 */
public interface OwnerNotifier {

    void notify(OwnerKey owner, String jobId, JobState state, String text);

    void reportToOperator(String jobId, JobState state, String text);
}
