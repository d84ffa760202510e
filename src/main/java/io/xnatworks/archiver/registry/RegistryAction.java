/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.registry;

/**
 * What a run does to the registry once the archive is sealed.
 */
public enum RegistryAction {
    /** Look the study up for information only, write nothing. */
    NONE,
    /** The study must be absent; a new record is created. */
    INSERT,
    /** The study must be present; its record is replaced. */
    UPDATE
}
