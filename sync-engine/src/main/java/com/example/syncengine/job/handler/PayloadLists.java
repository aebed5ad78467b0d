package com.example.syncengine.job.handler;

import com.example.syncengine.job.InvalidJobPayloadException;
import com.example.syncengine.job.JobContext;

import java.util.ArrayList;
import java.util.List;

final class PayloadLists {

    private PayloadLists() {
    }

    /**
     * A list of strings, or empty when the field is absent.
     */
    static List<String> strings(JobContext context, String field) {
        Object value = context.payload().get(field);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new InvalidJobPayloadException(context.jobId(), "'" + field + "' must be an array");
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object element : list) {
            if (!(element instanceof String text)) {
                throw new InvalidJobPayloadException(context.jobId(), "'" + field + "' must contain strings");
            }
            result.add(text);
        }
        return result;
    }
}
