package com.example.pdfcrop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfCropApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfCropApplication.class, args);
    }
}
