/**
 * Real-time session gateway: per-connection state machines that turn client audio and text into
 * transcribe, generate-reply and synthesize tasks and stream results back as frames.
 */
package com.phillippitts.voiceforge.service.gateway;
