package com.autotrader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationSettings {

    @Builder.Default
    private boolean onEntry = true;

    @Builder.Default
    private boolean onExit = true;

    @Builder.Default
    private boolean onError = true;

    public NotificationSettings copy() {
        return new NotificationSettings(onEntry, onExit, onError);
    }
}
