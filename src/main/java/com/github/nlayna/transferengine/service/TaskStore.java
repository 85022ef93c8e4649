package com.github.nlayna.transferengine.service;

import com.github.nlayna.transferengine.model.TransferStatus;
import com.github.nlayna.transferengine.model.TransferTask;

import java.util.List;
import java.util.Optional;

/**
 * Durable task records keyed by id. Writes to one task are serialized; writes to
 * different tasks proceed independently.
 */
public interface TaskStore {

    void save(TransferTask task);

    Optional<TransferTask> findById(String id);

    List<TransferTask> findAll();

    /**
     * @param statuses statuses to match, or none for every record
     */
    List<TransferTask> findByStatus(TransferStatus... statuses);

    boolean delete(String id);
}
