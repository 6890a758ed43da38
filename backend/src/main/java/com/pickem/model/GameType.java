package com.pickem.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "gametype")
public class GameType {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 8)
    private String id;

    @Column(name = "name", nullable = false, unique = true)
    private String name;
}
