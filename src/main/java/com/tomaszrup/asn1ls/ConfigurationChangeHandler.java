////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.asn1ls;

import com.google.gson.JsonObject;
import com.tomaszrup.asn1ls.config.Asn1Settings;

/**
 * Applies {@code workspace/didChangeConfiguration} settings to the
 * {@link Asn1Settings} store and forwards them to an optional listener.
 */
final class ConfigurationChangeHandler {

    /**
     * Callback for forwarding raw configuration settings to the server
     * layer, which reads {@code asn1.logLevel} from them.
     */
    @FunctionalInterface
    public interface SettingsChangeListener {
        void onSettingsChanged(JsonObject settings);
    }

    private final Asn1Settings settings;
    private SettingsChangeListener settingsChangeListener;

    ConfigurationChangeHandler(Asn1Settings settings) {
        this.settings = settings;
    }

    void setSettingsChangeListener(SettingsChangeListener listener) {
        this.settingsChangeListener = listener;
    }

    /**
     * Processes a didChangeConfiguration notification. Anything other than
     * a JSON object is ignored.
     *
     * @param rawSettings the raw settings object from the LSP params
     */
    void handleConfigurationChange(Object rawSettings) {
        if (!(rawSettings instanceof JsonObject)) {
            return;
        }
        JsonObject json = (JsonObject) rawSettings;
        settings.update(json);
        if (settingsChangeListener != null) {
            settingsChangeListener.onSettingsChanged(json);
        }
    }
}
