package com.entitystore.persistence;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class InsertResult {

    private boolean acknowledged;
}
