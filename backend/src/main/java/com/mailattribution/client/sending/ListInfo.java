package com.mailattribution.client.sending;

import lombok.Value;

@Value
public class ListInfo {
    String id;
    String name;
}
