package com.tarterware.pedalpath;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PedalPathApplication
{
    public static void main(String[] args)
    {
        SpringApplication.run(PedalPathApplication.class, args);
    }
}
