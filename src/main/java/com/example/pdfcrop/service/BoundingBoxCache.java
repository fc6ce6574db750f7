package com.example.pdfcrop.service;

import com.example.pdfcrop.model.DetectedBox;
import com.example.pdfcrop.model.DetectionFingerprint;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 边界框缓存：保存最近一次检测的全部边界框及其指纹
 * 指纹变化时整体丢弃，不做部分失效
 */
public class BoundingBoxCache {

    private DetectionFingerprint fingerprint;
    private Map<Integer, DetectedBox> boxes;

    public boolean matches(DetectionFingerprint candidate) {
        return fingerprint != null && fingerprint.equals(candidate);
    }

    public Map<Integer, DetectedBox> getBoxes() {
        return boxes;
    }

    public DetectionFingerprint getFingerprint() {
        return fingerprint;
    }

    public void store(DetectionFingerprint fingerprint, Map<Integer, DetectedBox> boxes) {
        this.fingerprint = fingerprint;
        this.boxes = Collections.unmodifiableMap(new TreeMap<>(boxes));
    }

    public void invalidate() {
        this.fingerprint = null;
        this.boxes = null;
    }
}
