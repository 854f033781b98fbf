package com.example.cratebridge.domain.model;

import com.example.cratebridge.domain.enumtype.SkipReason;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EntrySkip {

    /**
     * Identifies the skipped entry within its document: an id, a row number or a path.
     */
    private String entryRef;

    private SkipReason reason;

    private String detail;
}
