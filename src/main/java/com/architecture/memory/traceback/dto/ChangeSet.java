package com.architecture.memory.traceback.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeSet {

    @Builder.Default
    private Set<String> added = new HashSet<>();

    @Builder.Default
    private Set<String> deleted = new HashSet<>();

    @Builder.Default
    private Set<String> existing = new HashSet<>();
}
