package com.agile.Buro.Models;

import java.util.UUID;

/** Short user reference embedded in project and issue payloads. */
public record UserRef(UUID id, String fullName, String email) {}
