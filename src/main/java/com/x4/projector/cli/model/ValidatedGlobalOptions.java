package com.x4.projector.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ValidatedGlobalOptions {
    private Path gameRoot;
}
