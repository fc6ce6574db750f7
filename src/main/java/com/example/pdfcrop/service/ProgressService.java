package com.example.pdfcrop.service;

import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;

@Service
public class ProgressService {

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError((error) -> emitters.remove(emitter));

        return emitter;
    }

    public void sendProgress(String message) {
        send("progress", message);
    }

    /**
     * 裁剪完成事件，数据为会话 ID 和输出文件名
     */
    public void sendCropFinished(String sessionId, String fileName) {
        send("cropped", sessionId + ":" + fileName);
    }

    public int getEmitterCount() {
        return emitters.size();
    }

    private void send(String eventName, Object data) {
        emitters.forEach(emitter -> {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(data));
            } catch (IOException e) {
                emitter.complete();
                emitters.remove(emitter);
            }
        });
    }
}
